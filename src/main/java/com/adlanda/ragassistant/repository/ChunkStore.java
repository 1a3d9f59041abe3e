package com.adlanda.ragassistant.repository;

import org.springframework.ai.document.Document;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Store of embedded chunks, searchable by semantic similarity.
 *
 * <p>Each chunk is a Spring AI {@link Document}: id, text and flat metadata. Implementations
 * compute the embeddings themselves.
 */
public interface ChunkStore extends AutoCloseable {

    /**
     * Adds the documents as one batch. Embeddings for the whole batch are computed first;
     * when that fails nothing is stored. Documents whose id is already present are replaced.
     *
     * @throws com.adlanda.ragassistant.exception.StoreException if embedding or storing fails
     */
    void add(List<Document> documents);

    /**
     * Returns at most {@code k} documents ranked by similarity to {@code text}, most similar
     * first, each carrying its score.
     *
     * @param filter Metadata predicate applied before ranking, or null for no filtering
     */
    List<Document> query(String text, int k, Predicate<Map<String, Object>> filter);

    long count();

    /**
     * Returns every document whose metadata matches the filter, in insertion order.
     *
     * @param filter Metadata predicate, or null for all documents
     */
    List<Document> getAll(Predicate<Map<String, Object>> filter);

    boolean delete(String id);

    /**
     * Deletes every document whose metadata matches the filter.
     *
     * @return Number of documents deleted
     */
    int deleteWhere(Predicate<Map<String, Object>> filter);

    /**
     * Releases the store. Persistent implementations flush their state here.
     */
    @Override
    void close();
}
