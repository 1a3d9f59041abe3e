package com.adlanda.ragassistant.model;

import org.springframework.ai.document.Document;

import java.util.Map;

/**
 * A retrieved chunk with its position in the result list.
 *
 * @param rank     1 for the most relevant chunk
 * @param id       Store id of the chunk
 * @param text     Chunk text
 * @param metadata Flat provenance metadata
 * @param score    Cosine similarity (higher is more similar)
 */
public record RankedChunk(
        int rank,
        String id,
        String text,
        Map<String, Object> metadata,
        double score
) {
    public static RankedChunk from(Document document, int rank) {
        Double score = document.getScore();
        return new RankedChunk(rank, document.getId(), document.getText(), document.getMetadata(),
                score != null ? score : 0.0);
    }

    public SourceMetadata source() {
        return SourceMetadata.fromMap(metadata);
    }
}
