package com.adlanda.ragassistant.service;

import com.adlanda.ragassistant.config.RagProperties;
import com.adlanda.ragassistant.exception.GenerationException;
import com.adlanda.ragassistant.exception.ValidationException;
import com.adlanda.ragassistant.model.QueryAnswer;
import com.adlanda.ragassistant.model.RankedChunk;
import com.adlanda.ragassistant.repository.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Answers questions from stored messages and documents.
 *
 * Orchestrates the query flow:
 * 1. Retrieve the top-K most similar chunks
 * 2. Render them as a numbered grounding block with provenance
 * 3. Generate an answer constrained to that block, bounded by the generation timeout
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final ChunkStore chunkStore;
    private final GenerationService generationService;
    private final RagProperties properties;
    private final ExecutorService generationExecutor;

    public QueryService(ChunkStore chunkStore,
                        GenerationService generationService,
                        RagProperties properties,
                        @Qualifier("generationExecutor") ExecutorService generationExecutor) {
        this.chunkStore = chunkStore;
        this.generationService = generationService;
        this.properties = properties;
        this.generationExecutor = generationExecutor;
    }

    /**
     * Answers a question.
     *
     * @param query The question
     * @return The answer; {@code grounded} is false when nothing was retrieved
     * @throws ValidationException if the query is blank
     * @throws GenerationException if generation fails or times out
     */
    public QueryAnswer answer(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("No query provided");
        }
        long startTime = System.currentTimeMillis();

        List<RankedChunk> retrieved = retrieve(query, properties.getRetrieval().getTopK());
        String context = groundingBlock(retrieved);
        String answer = generate(instruction(), context, query);

        log.info("Answered query '{}' from {} chunks in {}ms",
                truncate(query, 50), retrieved.size(), System.currentTimeMillis() - startTime);
        return new QueryAnswer(answer, query, !retrieved.isEmpty(), retrieved.size());
    }

    List<RankedChunk> retrieve(String query, int topK) {
        List<Document> documents = chunkStore.query(query, topK, null);
        List<RankedChunk> ranked = new ArrayList<>(documents.size());
        for (Document document : documents) {
            ranked.add(RankedChunk.from(document, ranked.size() + 1));
        }
        log.debug("Retrieved {} chunks for query '{}'", ranked.size(), truncate(query, 50));
        return ranked;
    }

    /**
     * Renders retrieved chunks in rank order as {@code [n] provenance} followed by the chunk text.
     */
    String groundingBlock(List<RankedChunk> retrieved) {
        return retrieved.stream()
                .map(chunk -> "[" + chunk.rank() + "] " + SourceLabels.describe(chunk.metadata()) + "\n" + chunk.text())
                .collect(Collectors.joining("\n\n"));
    }

    String instruction() {
        RagProperties.Generation generation = properties.getGeneration();
        return """
                You are an assistant that answers questions using only the provided context, \
                which holds chat messages and documents shared through chat.

                Rules:
                - Answer only from the information in the context. Never make up facts or use outside knowledge.
                - If the context does not contain the answer, reply with exactly this sentence: "%s"
                - When you use a message, mention who sent it and when.
                - When you use a document, mention the document name and the page number if it is known.
                - When several sources are relevant, combine them into one coherent answer.
                - For general questions that are not about the context, you may give a short general answer.
                - Give the direct answer first, then the supporting references.
                - Respond in %s. Keep the tone %s.
                """.formatted(generation.getFallbackAnswer(), generation.getLanguage(), generation.getRegister());
    }

    private String generate(String instruction, String context, String query) {
        Duration timeout = properties.getGeneration().getTimeout();
        Future<String> future = generationExecutor.submit(
                () -> generationService.generate(instruction, context, query));

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GenerationException("Answer generation timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GenerationException("Answer generation was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GenerationException generationException) {
                throw generationException;
            }
            throw new GenerationException("Answer generation failed: " + cause.getMessage(), cause);
        }
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
