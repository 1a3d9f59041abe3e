package com.adlanda.ragassistant.model;

/**
 * Result of a semantic search that skips answer generation.
 */
public record SearchHit(
        int rank,
        String source,
        String datetime,
        String content,
        double score
) {}
