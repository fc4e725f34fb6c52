package com.deepansh.feed.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog entry as returned by the metadata backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContentMetadata {

    private String id;
    private String title;
    private String overview;
    private String posterPath;
    private String backdropPath;
    private String youtubeKey;
    private String imageUrl;

    /** trailer | teaser | clip | short | community | image */
    private String contentType;

    /** movie | tv */
    private String mediaType;

    @Builder.Default
    private List<String> genres = new ArrayList<>();

    private double popularity;
    private String releaseDate;
}
