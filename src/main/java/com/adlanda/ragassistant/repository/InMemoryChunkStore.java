package com.adlanda.ragassistant.repository;

import com.adlanda.ragassistant.exception.StoreException;
import com.adlanda.ragassistant.service.EmbeddingService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * In-memory {@link ChunkStore} using cosine similarity over embeddings from {@link EmbeddingService}.
 *
 * Reads are lock-free; writes are serialized. When a snapshot path is given, the store is loaded
 * from that JSON file on creation and written back on {@link #close()}.
 */
public class InMemoryChunkStore implements ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChunkStore.class);

    private final EmbeddingService embeddingService;
    private final ObjectMapper objectMapper;
    private final Path snapshotPath;

    private final Map<String, StoredChunk> chunks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryChunkStore(EmbeddingService embeddingService) {
        this(embeddingService, new ObjectMapper(), null);
    }

    /**
     * @param snapshotPath JSON snapshot file, or null to keep the store purely in memory
     */
    public InMemoryChunkStore(EmbeddingService embeddingService, ObjectMapper objectMapper, Path snapshotPath) {
        this.embeddingService = embeddingService;
        this.objectMapper = objectMapper;
        this.snapshotPath = snapshotPath;
        loadSnapshot();
    }

    @Override
    public void add(List<Document> documents) {
        if (documents.isEmpty()) {
            return;
        }

        List<float[]> embeddings;
        try {
            embeddings = embeddingService.embedAll(documents.stream().map(Document::getText).toList());
        } catch (RuntimeException e) {
            throw new StoreException("Failed to embed " + documents.size() + " chunks: " + e.getMessage(), e);
        }
        if (embeddings.size() != documents.size()) {
            throw new StoreException("Embedding model returned " + embeddings.size()
                    + " vectors for " + documents.size() + " chunks");
        }

        synchronized (this) {
            for (int i = 0; i < documents.size(); i++) {
                Document document = documents.get(i);
                chunks.put(document.getId(), new StoredChunk(
                        sequence.incrementAndGet(),
                        document.getId(),
                        document.getText(),
                        Map.copyOf(document.getMetadata()),
                        embeddings.get(i)
                ));
            }
        }
        log.info("Stored {} chunks in chunk store ({} total)", documents.size(), chunks.size());
    }

    @Override
    public List<Document> query(String text, int k, Predicate<Map<String, Object>> filter) {
        float[] queryEmbedding;
        try {
            queryEmbedding = embeddingService.embed(text);
        } catch (RuntimeException e) {
            throw new StoreException("Failed to embed query: " + e.getMessage(), e);
        }

        return chunks.values().stream()
                .filter(chunk -> filter == null || filter.test(chunk.metadata()))
                .map(chunk -> new ScoredChunk(chunk, cosineSimilarity(queryEmbedding, chunk.embedding())))
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed()
                        .thenComparingLong(scored -> scored.chunk().sequence()))
                .limit(Math.max(k, 0))
                .map(scored -> scored.chunk().toDocument(scored.score()))
                .toList();
    }

    @Override
    public long count() {
        return chunks.size();
    }

    @Override
    public List<Document> getAll(Predicate<Map<String, Object>> filter) {
        return chunks.values().stream()
                .filter(chunk -> filter == null || filter.test(chunk.metadata()))
                .sorted(Comparator.comparingLong(StoredChunk::sequence))
                .map(chunk -> chunk.toDocument(null))
                .toList();
    }

    @Override
    public synchronized boolean delete(String id) {
        return chunks.remove(id) != null;
    }

    @Override
    public synchronized int deleteWhere(Predicate<Map<String, Object>> filter) {
        List<String> ids = chunks.values().stream()
                .filter(chunk -> filter.test(chunk.metadata()))
                .map(StoredChunk::id)
                .toList();
        ids.forEach(chunks::remove);
        log.debug("Deleted {} chunks", ids.size());
        return ids.size();
    }

    @Override
    public synchronized void close() {
        if (snapshotPath == null) {
            return;
        }
        List<StoredChunk> ordered = new ArrayList<>(chunks.values());
        ordered.sort(Comparator.comparingLong(StoredChunk::sequence));
        try {
            Path parent = snapshotPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(snapshotPath.toFile(), ordered);
            log.info("Saved {} chunks to snapshot {}", ordered.size(), snapshotPath);
        } catch (IOException e) {
            throw new StoreException("Failed to write chunk store snapshot " + snapshotPath, e);
        }
    }

    private void loadSnapshot() {
        if (snapshotPath == null || !Files.exists(snapshotPath)) {
            return;
        }
        try {
            List<StoredChunk> stored = objectMapper.readValue(snapshotPath.toFile(), new TypeReference<>() {});
            for (StoredChunk chunk : stored) {
                chunks.put(chunk.id(), new StoredChunk(sequence.incrementAndGet(), chunk.id(), chunk.text(),
                        chunk.metadata(), chunk.embedding()));
            }
            log.info("Loaded {} chunks from snapshot {}", stored.size(), snapshotPath);
        } catch (IOException e) {
            throw new StoreException("Failed to read chunk store snapshot " + snapshotPath, e);
        }
    }

    /**
     * Computes cosine similarity between two vectors.
     *
     * @return Similarity between -1 and 1 (1 = same direction); 0 when either vector is zero
     */
    private double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new StoreException("Embedding dimensions differ: " + a.length + " vs " + b.length);
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * A stored chunk; also the snapshot record format.
     */
    record StoredChunk(
            long sequence,
            String id,
            String text,
            Map<String, Object> metadata,
            float[] embedding
    ) {
        Document toDocument(Double score) {
            return Document.builder()
                    .id(id)
                    .text(text)
                    .metadata(metadata)
                    .score(score)
                    .build();
        }
    }

    private record ScoredChunk(StoredChunk chunk, double score) {}
}
