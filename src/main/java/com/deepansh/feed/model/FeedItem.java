package com.deepansh.feed.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Hydrated item returned to clients. Produced on demand, never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedItem {

    private String id;
    private String title;
    private String overview;
    private String posterRef;
    private String backdropRef;
    private String playbackRef;
    private String contentType;
    private String mediaType;
    private List<String> tags;
    private double popularity;
    private String releaseDate;

    public static FeedItem from(ContentMetadata metadata) {
        String playback = metadata.getYoutubeKey() != null ? metadata.getYoutubeKey() : metadata.getImageUrl();
        return FeedItem.builder()
                .id(metadata.getId())
                .title(metadata.getTitle() != null ? metadata.getTitle() : "Untitled")
                .overview(metadata.getOverview())
                .posterRef(metadata.getPosterPath())
                .backdropRef(metadata.getBackdropPath())
                .playbackRef(playback)
                .contentType(metadata.getContentType() != null ? metadata.getContentType() : "trailer")
                .mediaType(metadata.getMediaType() != null ? metadata.getMediaType() : "movie")
                .tags(metadata.getGenres() != null ? List.copyOf(metadata.getGenres()) : List.of())
                .popularity(metadata.getPopularity())
                .releaseDate(metadata.getReleaseDate())
                .build();
    }
}
