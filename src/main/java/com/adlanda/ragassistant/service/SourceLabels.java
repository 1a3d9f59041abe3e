package com.adlanda.ragassistant.service;

import com.adlanda.ragassistant.model.MetadataKeys;

import java.util.Map;

/**
 * Human-readable provenance labels for stored chunks.
 */
final class SourceLabels {

    private SourceLabels() {
    }

    /**
     * {@code Document: report.pdf, page 3} (or {@code page unknown}) for document chunks,
     * {@code Message from Alice (6012345@chat) at 2024-01-01 10:00:00} for message chunks.
     */
    static String describe(Map<String, Object> metadata) {
        if (MetadataKeys.TYPE_DOCUMENT.equals(metadata.get(MetadataKeys.SOURCE_TYPE))) {
            int page = page(metadata);
            return "Document: " + value(metadata, MetadataKeys.FILE_NAME, "Unknown")
                    + ", page " + (page > 0 ? String.valueOf(page) : "unknown");
        }
        return "Message from " + value(metadata, MetadataKeys.SENDER_NAME, "Unknown")
                + " (" + value(metadata, MetadataKeys.SENDER, "unknown_sender") + ")"
                + " at " + value(metadata, MetadataKeys.DATETIME, "unknown time");
    }

    static int page(Map<String, Object> metadata) {
        Object page = metadata.get(MetadataKeys.PAGE);
        if (page instanceof Number number) {
            return number.intValue();
        }
        try {
            return page != null ? Integer.parseInt(page.toString()) : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static int chunkIndex(Map<String, Object> metadata) {
        Object index = metadata.get(MetadataKeys.CHUNK_INDEX);
        return index instanceof Number number ? number.intValue() : 0;
    }

    static String value(Map<String, Object> metadata, String key, String fallback) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : fallback;
    }
}
