package com.deepansh.feed.context;

import java.util.Set;

/**
 * Narrow read interface over one externally owned user data source.
 * Implementations may block; the loader bounds each call with a timeout.
 */
public interface UserSignalSource {

    /** Stable name reported in UserContext.degradedSources */
    String name();

    Set<String> fetch(String userId);
}
