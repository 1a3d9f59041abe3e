package com.adlanda.ragassistant.service.chunking;

import com.adlanda.ragassistant.exception.ConfigurationException;

/**
 * Validated chunk size and overlap, both in characters.
 */
public record ChunkingParameters(int chunkSize, int chunkOverlap) {

    public ChunkingParameters {
        if (chunkSize <= 0) {
            throw new ConfigurationException("Chunk size must be positive, got " + chunkSize);
        }
        if (chunkOverlap < 0) {
            throw new ConfigurationException("Chunk overlap must not be negative, got " + chunkOverlap);
        }
        if (chunkOverlap >= chunkSize) {
            throw new ConfigurationException(
                    "Chunk overlap (" + chunkOverlap + ") must be smaller than chunk size (" + chunkSize + ")");
        }
    }
}
