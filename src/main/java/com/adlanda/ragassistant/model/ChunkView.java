package com.adlanda.ragassistant.model;

/**
 * A stored chunk of one document, as shown by the document view.
 */
public record ChunkView(
        int page,
        int chunkIndex,
        String content
) {}
