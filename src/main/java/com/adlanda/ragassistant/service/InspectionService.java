package com.adlanda.ragassistant.service;

import com.adlanda.ragassistant.exception.NotFoundException;
import com.adlanda.ragassistant.exception.ValidationException;
import com.adlanda.ragassistant.model.ChunkView;
import com.adlanda.ragassistant.model.DocumentFormat;
import com.adlanda.ragassistant.model.MetadataKeys;
import com.adlanda.ragassistant.model.SearchHit;
import com.adlanda.ragassistant.model.SourceSummary;
import com.adlanda.ragassistant.model.StoreStats;
import com.adlanda.ragassistant.model.TermMatch;
import com.adlanda.ragassistant.repository.ChunkFilters;
import com.adlanda.ragassistant.repository.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only views over the chunk store, for debugging what has been ingested.
 */
@Service
public class InspectionService {

    private static final Logger log = LoggerFactory.getLogger(InspectionService.class);

    static final int CONTEXT_CHARS = 50;

    private final ChunkStore chunkStore;

    public InspectionService(ChunkStore chunkStore) {
        this.chunkStore = chunkStore;
    }

    /**
     * Lists distinct documents (by sender and file name) and messages (by message id), most recent first.
     *
     * @param fileName When not null, only the document with this file name is listed
     */
    public List<SourceSummary> listSources(String fileName) {
        List<Document> documents = chunkStore.getAll(fileName != null ? ChunkFilters.document(fileName) : null);

        Map<String, List<Document>> bySource = new LinkedHashMap<>();
        for (Document document : documents) {
            Map<String, Object> metadata = document.getMetadata();
            String key = MetadataKeys.TYPE_DOCUMENT.equals(metadata.get(MetadataKeys.SOURCE_TYPE))
                    ? MetadataKeys.TYPE_DOCUMENT + ":" + metadata.get(MetadataKeys.SENDER) + "/" + sourceKey(metadata)
                    : MetadataKeys.TYPE_MESSAGE + ":" + sourceKey(metadata);
            bySource.computeIfAbsent(key, k -> new ArrayList<>()).add(document);
        }

        return bySource.values().stream()
                .map(this::summarize)
                .sorted(Comparator.comparingLong(SourceSummary::timestamp).reversed())
                .toList();
    }

    /**
     * Returns every chunk of one document, ordered by page then chunk index.
     *
     * @throws NotFoundException if no chunks are stored for the file name
     */
    public List<ChunkView> viewDocument(String fileName) {
        List<ChunkView> views = chunkStore.getAll(ChunkFilters.document(fileName)).stream()
                .map(document -> new ChunkView(
                        SourceLabels.page(document.getMetadata()),
                        SourceLabels.chunkIndex(document.getMetadata()),
                        document.getText()))
                .sorted(Comparator.comparingInt(ChunkView::page).thenComparingInt(ChunkView::chunkIndex))
                .toList();

        if (views.isEmpty()) {
            throw new NotFoundException("No chunks found for document: " + fileName);
        }
        return views;
    }

    /**
     * Finds chunks containing {@code term} (case-insensitive), with the text around its first occurrence.
     */
    public List<TermMatch> findTerm(String term) {
        if (term == null || term.isBlank()) {
            throw new ValidationException("Search term is required");
        }
        Pattern needle = Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

        List<TermMatch> matches = new ArrayList<>();
        for (Document document : chunkStore.getAll(null)) {
            String text = document.getText();
            Matcher matcher = needle.matcher(text);
            if (matcher.find()) {
                matches.add(new TermMatch(
                        SourceLabels.describe(document.getMetadata()),
                        contextWindow(text, matcher.start(), matcher.end() - matcher.start()),
                        text,
                        document.getMetadata()));
            }
        }

        log.debug("Term '{}' found in {} chunks", term, matches.size());
        return matches;
    }

    /**
     * Semantic search without answer generation.
     */
    public List<SearchHit> search(String query, int topK) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("No query provided");
        }
        if (topK <= 0) {
            throw new ValidationException("topK must be positive");
        }

        List<Document> documents = chunkStore.query(query, topK, null);
        List<SearchHit> hits = new ArrayList<>(documents.size());
        for (Document document : documents) {
            Double score = document.getScore();
            hits.add(new SearchHit(
                    hits.size() + 1,
                    SourceLabels.describe(document.getMetadata()),
                    SourceLabels.value(document.getMetadata(), MetadataKeys.DATETIME, ""),
                    document.getText(),
                    score != null ? score : 0.0));
        }
        return hits;
    }

    /**
     * Total chunk count and chunk count per document type, plus {@code message}.
     */
    public StoreStats stats() {
        Map<String, Long> byType = new LinkedHashMap<>();
        for (DocumentFormat format : DocumentFormat.values()) {
            byType.put(format.extension(), 0L);
        }
        byType.put(MetadataKeys.TYPE_MESSAGE, 0L);

        List<Document> documents = chunkStore.getAll(null);
        for (Document document : documents) {
            Map<String, Object> metadata = document.getMetadata();
            String type = MetadataKeys.TYPE_DOCUMENT.equals(metadata.get(MetadataKeys.SOURCE_TYPE))
                    ? SourceLabels.value(metadata, MetadataKeys.DOCUMENT_TYPE, "unknown")
                    : MetadataKeys.TYPE_MESSAGE;
            byType.merge(type, 1L, Long::sum);
        }
        return new StoreStats(documents.size(), byType);
    }

    static String contextWindow(String text, int index, int termLength) {
        int start = Math.max(0, index - CONTEXT_CHARS);
        int end = Math.min(text.length(), index + termLength + CONTEXT_CHARS);
        return (start > 0 ? "..." : "") + text.substring(start, end) + (end < text.length() ? "..." : "");
    }

    private SourceSummary summarize(List<Document> chunks) {
        Map<String, Object> metadata = chunks.get(0).getMetadata();
        boolean document = MetadataKeys.TYPE_DOCUMENT.equals(metadata.get(MetadataKeys.SOURCE_TYPE));
        Object timestamp = metadata.get(MetadataKeys.TIMESTAMP);

        return new SourceSummary(
                sourceKey(metadata),
                document ? MetadataKeys.TYPE_DOCUMENT : MetadataKeys.TYPE_MESSAGE,
                document ? SourceLabels.value(metadata, MetadataKeys.DOCUMENT_TYPE, null) : null,
                SourceLabels.value(metadata, MetadataKeys.SENDER_NAME, "Unknown"),
                Boolean.parseBoolean(String.valueOf(metadata.get(MetadataKeys.GROUP))),
                timestamp instanceof Number number ? number.longValue() : 0L,
                SourceLabels.value(metadata, MetadataKeys.DATETIME, ""),
                chunks.size()
        );
    }

    private String sourceKey(Map<String, Object> metadata) {
        if (MetadataKeys.TYPE_DOCUMENT.equals(metadata.get(MetadataKeys.SOURCE_TYPE))) {
            return SourceLabels.value(metadata, MetadataKeys.FILE_NAME, "unknown");
        }
        return SourceLabels.value(metadata, MetadataKeys.MESSAGE_ID, "unknown_id");
    }
}
