package com.adlanda.ragassistant.service.chunking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits text into pieces of at most {@code chunkSize} characters with overlapping context.
 *
 * <p>Separators are tried from coarsest to finest: paragraph break, line break, sentence end,
 * space, and finally single characters. Each separator stays attached to the start of the
 * piece that follows it, so merged chunks reproduce the original text. Pieces that are still
 * too long are split again with the next separator.
 *
 * <p>Adjacent pieces are merged greedily. When a chunk is emitted, pieces are dropped from the
 * front of the window until at most {@code chunkOverlap} characters remain; those carry over
 * into the next chunk.
 *
 * <p>Stateless and thread-safe.
 */
public class RecursiveTextSplitter {

    private static final Logger log = LoggerFactory.getLogger(RecursiveTextSplitter.class);

    static final List<String> DEFAULT_SEPARATORS = List.of("\n\n", "\n", ". ", " ", "");

    private final int chunkSize;
    private final int chunkOverlap;
    private final List<String> separators;

    public RecursiveTextSplitter(ChunkingParameters parameters) {
        this(parameters, DEFAULT_SEPARATORS);
    }

    RecursiveTextSplitter(ChunkingParameters parameters, List<String> separators) {
        this.chunkSize = parameters.chunkSize();
        this.chunkOverlap = parameters.chunkOverlap();
        this.separators = List.copyOf(separators);
    }

    /**
     * Splits the text into trimmed, non-blank chunks no longer than the chunk size.
     */
    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return split(text, separators);
    }

    private List<String> split(String text, List<String> candidates) {
        // Pick the coarsest separator present in the text
        String separator = candidates.get(candidates.size() - 1);
        List<String> finer = List.of();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                finer = candidates.subList(i + 1, candidates.size());
                break;
            }
        }

        List<String> result = new ArrayList<>();
        List<String> pending = new ArrayList<>();

        for (String piece : splitKeepingSeparator(text, separator)) {
            if (piece.length() < chunkSize) {
                pending.add(piece);
                continue;
            }
            if (!pending.isEmpty()) {
                result.addAll(merge(pending));
                pending.clear();
            }
            if (finer.isEmpty()) {
                result.add(piece);
            } else {
                result.addAll(split(piece, finer));
            }
        }

        if (!pending.isEmpty()) {
            result.addAll(merge(pending));
        }
        return result;
    }

    private List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); i++) {
                pieces.add(String.valueOf(text.charAt(i)));
            }
            return pieces;
        }

        int start = 0;
        int next = text.indexOf(separator);
        while (next >= 0) {
            if (next > start) {
                pieces.add(text.substring(start, next));
            }
            start = next;
            next = text.indexOf(separator, start + separator.length());
        }
        if (start < text.length()) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }

    private List<String> merge(List<String> pieces) {
        List<String> chunks = new ArrayList<>();
        Deque<String> window = new ArrayDeque<>();
        int total = 0;

        for (String piece : pieces) {
            int length = piece.length();
            if (total + length > chunkSize && !window.isEmpty()) {
                if (total > chunkSize) {
                    log.warn("Created a chunk of {} characters, longer than the limit of {}", total, chunkSize);
                }
                addIfNotBlank(chunks, String.join("", window));

                while (total > chunkOverlap || (total + length > chunkSize && total > 0)) {
                    total -= window.removeFirst().length();
                }
            }
            window.addLast(piece);
            total += length;
        }

        addIfNotBlank(chunks, String.join("", window));
        return chunks;
    }

    private void addIfNotBlank(List<String> chunks, String chunk) {
        String trimmed = chunk.strip();
        if (!trimmed.isEmpty()) {
            chunks.add(trimmed);
        }
    }
}
