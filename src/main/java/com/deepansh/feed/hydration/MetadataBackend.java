package com.deepansh.feed.hydration;

import com.deepansh.feed.model.ContentMetadata;

import java.util.Collection;
import java.util.Map;

/**
 * Source of truth for content metadata.
 * Implementations must resolve a whole batch in one round trip.
 */
public interface MetadataBackend {

    /**
     * Metadata keyed by id. Ids the backend does not know are simply absent.
     */
    Map<String, ContentMetadata> batchLookup(Collection<String> ids);
}
