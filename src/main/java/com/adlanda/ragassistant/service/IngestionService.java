package com.adlanda.ragassistant.service;

import com.adlanda.ragassistant.config.RagProperties;
import com.adlanda.ragassistant.exception.ExtractionException;
import com.adlanda.ragassistant.exception.NotFoundException;
import com.adlanda.ragassistant.exception.RagException;
import com.adlanda.ragassistant.exception.UnsupportedFormatException;
import com.adlanda.ragassistant.exception.ValidationException;
import com.adlanda.ragassistant.health.IngestionHealthIndicator;
import com.adlanda.ragassistant.model.Chunk;
import com.adlanda.ragassistant.model.DocumentFormat;
import com.adlanda.ragassistant.model.DocumentRequest;
import com.adlanda.ragassistant.model.DocumentSource;
import com.adlanda.ragassistant.model.IngestionReport;
import com.adlanda.ragassistant.model.MessageRequest;
import com.adlanda.ragassistant.model.MessageSource;
import com.adlanda.ragassistant.model.MetadataKeys;
import com.adlanda.ragassistant.model.Origin;
import com.adlanda.ragassistant.repository.ChunkFilters;
import com.adlanda.ragassistant.repository.ChunkStore;
import com.adlanda.ragassistant.service.chunking.ChunkingParameters;
import com.adlanda.ragassistant.service.chunking.TextChunker;
import com.adlanda.ragassistant.service.extraction.DocumentInfo;
import com.adlanda.ragassistant.service.extraction.ExtractionResult;
import com.adlanda.ragassistant.service.extraction.TextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Service responsible for turning messages and documents into stored chunks.
 *
 * Document flow:
 * 1. Resolve the format from the file name and hash the bytes
 * 2. Skip the document if the same sender already has this file name indexed with the same hash
 * 3. Extract pages, chunk them and attach provenance
 * 4. Add the new chunks, then remove chunks left over from that sender's older version
 *
 * A document is identified by sender and file name, so two senders can each keep their own
 * {@code document.pdf}. Attempts for the same document are serialized; messages are only ever added.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final List<TextExtractor> extractors;
    private final TextChunker chunker;
    private final ProvenanceEnricher enricher;
    private final ChunkStore chunkStore;
    private final ContentHashService hashService;
    private final RagProperties properties;
    private final Clock clock;
    private final IngestionHealthIndicator healthIndicator;

    private final Map<String, SourceLock> sourceLocks = new ConcurrentHashMap<>();

    public IngestionService(List<TextExtractor> extractors,
                            TextChunker chunker,
                            ProvenanceEnricher enricher,
                            ChunkStore chunkStore,
                            ContentHashService hashService,
                            RagProperties properties,
                            Clock clock,
                            IngestionHealthIndicator healthIndicator) {
        this.extractors = extractors;
        this.chunker = chunker;
        this.enricher = enricher;
        this.chunkStore = chunkStore;
        this.hashService = hashService;
        this.properties = properties;
        this.clock = clock;
        this.healthIndicator = healthIndicator;

        // fail at startup on bad chunking settings
        new ChunkingParameters(properties.getChunking().getSize(), properties.getChunking().getOverlap());
    }

    /**
     * Stores a chat message. Messages longer than the chunk size are split.
     */
    public IngestionReport ingestMessage(MessageRequest request) {
        if (request.content() == null || request.content().isBlank()) {
            throw new ValidationException("Message content is required");
        }
        Origin origin = originOf(request.messageId(), request.sender(), request.senderName(),
                request.timestamp(), request.isGroup());

        return tracked(() -> {
            List<Chunk> chunks = chunker.chunkText(request.content(),
                    properties.getChunking().getSize(), properties.getChunking().getOverlap());
            List<Document> documents = enricher.toDocuments(enricher.enrich(chunks, new MessageSource(origin)));
            chunkStore.add(documents);

            log.info("Stored message {} from {} as {} chunks", origin.messageId(), origin.senderName(), documents.size());
            return IngestionReport.message(origin.messageId(), documents.size());
        });
    }

    /**
     * Decodes a base64 document sent through chat and ingests it.
     */
    public IngestionReport ingestDocument(DocumentRequest request) {
        if (request.documentData() == null || request.documentData().isBlank()) {
            throw new NotFoundException("No document data provided");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(request.documentData().replaceAll("\\s", ""));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Document data is not valid base64: " + e.getMessage());
        }
        Origin origin = originOf(request.messageId(), request.sender(), request.senderName(),
                request.timestamp(), request.isGroup());
        return ingestDocument(bytes, request.fileName(), origin);
    }

    /**
     * Extracts, chunks and stores one document.
     *
     * @param bytes    Raw document bytes
     * @param fileName Original file name; its extension selects the extractor
     * @param origin   Who sent the document and when
     * @return Report of the ingestion; {@code skipped} when the same content is already indexed
     * @throws NotFoundException          if there are no bytes
     * @throws UnsupportedFormatException if the extension is not PDF, DOCX or DOC
     * @throws ExtractionException        if no text could be extracted or chunked
     */
    public IngestionReport ingestDocument(byte[] bytes, String fileName, Origin origin) {
        if (bytes == null || bytes.length == 0) {
            throw new NotFoundException("No document data provided for " + fileName);
        }
        DocumentFormat format = DocumentFormat.fromFileName(fileName);

        return tracked(() -> withSourceLock(origin.senderId() + "/" + fileName,
                () -> processDocument(bytes, fileName, format, origin)));
    }

    /**
     * Ingests every PDF, DOCX and DOC file under a directory. Failures are logged per file
     * and do not stop the scan.
     */
    public List<IngestionReport> ingestDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("Bootstrap directory does not exist: {}", directory);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> paths = Files.walk(directory)) {
            files = paths.filter(Files::isRegularFile)
                    .filter(IngestionService::isSupportedFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Failed to walk bootstrap directory: {}", directory, e);
            return List.of();
        }

        List<IngestionReport> reports = new ArrayList<>();
        for (Path file : files) {
            try {
                Origin origin = new Origin("file:" + file.getFileName(), "local", "Local Directory",
                        Files.getLastModifiedTime(file).toInstant().getEpochSecond(), false);
                reports.add(ingestDocument(Files.readAllBytes(file), file.getFileName().toString(), origin));
            } catch (IOException e) {
                log.error("Failed to read file: {}", file, e);
            } catch (RagException e) {
                log.error("Failed to ingest file {}: {}", file, e.getMessage());
            }
        }

        log.info("Bootstrap ingestion finished: {} of {} files ingested", reports.size(), files.size());
        return reports;
    }

    private IngestionReport processDocument(byte[] bytes, String fileName, DocumentFormat format, Origin origin) {
        String contentHash = hashService.computeHash(bytes);

        // without incremental mode documents are only ever added
        List<Document> existing = properties.getIngestion().isIncremental()
                ? chunkStore.getAll(ChunkFilters.document(origin.senderId(), fileName))
                : List.of();
        if (!existing.isEmpty()
                && existing.stream().allMatch(doc -> contentHash.equals(doc.getMetadata().get(MetadataKeys.CONTENT_HASH)))) {
            log.info("Skipping {}: already indexed with the same content", fileName);
            return IngestionReport.unchanged(fileName, format);
        }

        ExtractionResult result = extractorFor(format).extract(bytes);
        if (result instanceof ExtractionResult.Failed failed) {
            throw new ExtractionException("Failed to extract text from " + fileName + ": " + failed.reason(), failed.cause());
        }
        if (result instanceof ExtractionResult.Empty) {
            throw new ExtractionException("No text could be extracted from " + fileName
                    + ". The document might be scanned or image-based.");
        }
        ExtractionResult.Extracted extracted = (ExtractionResult.Extracted) result;
        DocumentInfo info = extracted.info();

        List<Chunk> chunks = chunker.chunk(extracted.pages(),
                properties.getChunking().getSize(), properties.getChunking().getOverlap());
        if (chunks.isEmpty()) {
            throw new ExtractionException("No chunks were produced from " + fileName);
        }

        DocumentSource source = new DocumentSource(origin, fileName, format,
                info.title(), info.author(), info.subject(), info.totalPages(), contentHash);
        List<Document> documents = enricher.toDocuments(enricher.enrich(chunks, source));

        chunkStore.add(documents);

        Set<String> newIds = documents.stream().map(Document::getId).collect(Collectors.toSet());
        long replaced = existing.stream()
                .map(Document::getId)
                .filter(id -> !newIds.contains(id))
                .filter(chunkStore::delete)
                .count();
        if (!existing.isEmpty()) {
            log.info("Replaced previous version of {} from {} ({} stale chunks removed)",
                    fileName, origin.senderId(), replaced);
        }

        log.info("Ingested {} ({}): {} pages, {} chunks", fileName, format.extension(),
                extracted.pages().size(), documents.size());
        return IngestionReport.document(fileName, format, documents.size(), extracted.pages().size());
    }

    private TextExtractor extractorFor(DocumentFormat format) {
        return extractors.stream()
                .filter(extractor -> extractor.supports(format))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException("No extractor available for ." + format.extension()));
    }

    private Origin originOf(String messageId, String sender, String senderName, Long timestamp, boolean group) {
        long epochSeconds = timestamp != null ? timestamp : clock.instant().getEpochSecond();
        return new Origin(messageId, sender, senderName, epochSeconds, group);
    }

    private IngestionReport tracked(Supplier<IngestionReport> ingestion) {
        try {
            IngestionReport report = ingestion.get();
            healthIndicator.markHealthy(report);
            return report;
        } catch (RagException e) {
            healthIndicator.markUnhealthy(e.getMessage());
            throw e;
        }
    }

    private <T> T withSourceLock(String key, Supplier<T> action) {
        SourceLock entry = sourceLocks.compute(key, (k, current) -> {
            SourceLock held = current != null ? current : new SourceLock();
            held.holders++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            // the last holder removes the entry
            sourceLocks.compute(key, (k, current) -> --current.holders == 0 ? null : current);
        }
    }

    int activeSourceLocks() {
        return sourceLocks.size();
    }

    /**
     * Lock for one document plus the number of threads holding or waiting for it.
     * {@code holders} is only touched inside {@link ConcurrentHashMap#compute}.
     */
    private static final class SourceLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }

    private static boolean isSupportedFile(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return Stream.of(DocumentFormat.values()).anyMatch(format -> format.extension().equals(extension));
    }
}
