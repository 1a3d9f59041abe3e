package com.adlanda.ragassistant.model;

import java.util.Map;

/**
 * Store-wide statistics.
 *
 * @param totalChunks   Number of stored chunks
 * @param documentTypes Chunk count per document type ({@code pdf}, {@code docx}, {@code doc}) and {@code message}
 */
public record StoreStats(
        long totalChunks,
        Map<String, Long> documentTypes
) {}
