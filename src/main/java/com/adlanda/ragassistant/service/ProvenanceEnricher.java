package com.adlanda.ragassistant.service;

import com.adlanda.ragassistant.model.Chunk;
import com.adlanda.ragassistant.model.MetadataKeys;
import com.adlanda.ragassistant.model.SourceMetadata;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Attaches provenance to chunks and flattens them into store documents.
 */
@Component
public class ProvenanceEnricher {

    private final ZoneId zoneId;

    public ProvenanceEnricher(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    /**
     * Returns the chunks with {@code source} attached. Text, page and index are untouched.
     */
    public List<Chunk> enrich(List<Chunk> chunks, SourceMetadata source) {
        return chunks.stream()
                .map(chunk -> chunk.withSource(source))
                .toList();
    }

    /**
     * Converts enriched chunks into store documents.
     *
     * <p>The chunk keys ({@code page}, {@code chunkIndex}) are written first and source keys
     * never overwrite them. Ids are derived from the source key, chunk index and text, so
     * re-ingesting identical content yields identical ids.
     */
    public List<Document> toDocuments(List<Chunk> chunks) {
        return chunks.stream()
                .map(this::toDocument)
                .toList();
    }

    private Document toDocument(Chunk chunk) {
        if (chunk.source() == null) {
            throw new IllegalArgumentException("Chunk " + chunk.chunkIndex() + " has no source metadata");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.PAGE, chunk.pageNumber());
        metadata.put(MetadataKeys.CHUNK_INDEX, chunk.chunkIndex());
        chunk.source().toMap(zoneId).forEach(metadata::putIfAbsent);

        return new Document(chunkId(chunk), chunk.text(), metadata);
    }

    static String chunkId(Chunk chunk) {
        String seed = chunk.source().sourceKey() + ":" + chunk.chunkIndex() + ":" + chunk.text();
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
