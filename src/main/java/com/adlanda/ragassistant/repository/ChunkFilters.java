package com.adlanda.ragassistant.repository;

import com.adlanda.ragassistant.model.MetadataKeys;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Metadata predicates for {@link ChunkStore} lookups.
 */
public final class ChunkFilters {

    private ChunkFilters() {
    }

    public static Predicate<Map<String, Object>> documents() {
        return metadata -> MetadataKeys.TYPE_DOCUMENT.equals(metadata.get(MetadataKeys.SOURCE_TYPE));
    }

    public static Predicate<Map<String, Object>> messages() {
        return metadata -> MetadataKeys.TYPE_MESSAGE.equals(metadata.get(MetadataKeys.SOURCE_TYPE));
    }

    /**
     * Chunks of the document with the given file name (exact match).
     */
    public static Predicate<Map<String, Object>> document(String fileName) {
        return documents().and(metadata -> fileName.equals(metadata.get(MetadataKeys.FILE_NAME)));
    }

    /**
     * Chunks of one sender's document with the given file name.
     */
    public static Predicate<Map<String, Object>> document(String sender, String fileName) {
        return document(fileName).and(metadata -> sender.equals(metadata.get(MetadataKeys.SENDER)));
    }
}
