package com.deepansh.feed.exception;

public class CandidatesUnavailableException extends FeedException {

    public CandidatesUnavailableException(String sessionId) {
        super("CANDIDATES_UNAVAILABLE", true,
                "No candidate bucket could be read for session " + sessionId);
    }
}
