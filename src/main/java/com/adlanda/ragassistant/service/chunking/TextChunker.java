package com.adlanda.ragassistant.service.chunking;

import com.adlanda.ragassistant.model.Chunk;
import com.adlanda.ragassistant.model.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns the pages of a document into overlapping, page-attributed chunks.
 *
 * <p>Pages are rendered as {@code "Page N: text"} and joined with blank lines before splitting,
 * so every page boundary carries a marker. After splitting, a chunk that starts with a marker is
 * attributed to that page. A chunk that starts mid-page gets {@link Chunk#UNKNOWN_PAGE}; the page
 * is not inferred from neighbouring chunks. Markers are removed from the stored text.
 */
@Component
public class TextChunker {

    private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

    private static final Pattern LEADING_MARKER = Pattern.compile("^Page (\\d+):");
    private static final Pattern ANY_MARKER = Pattern.compile("Page \\d+: ");

    /**
     * Splits pages into chunks numbered from 1.
     *
     * @param pages        Pages in document order
     * @param chunkSize    Maximum chunk length in characters
     * @param chunkOverlap Characters shared by consecutive chunks
     * @return Chunks in document order; empty when there are no pages
     * @throws com.adlanda.ragassistant.exception.ConfigurationException if overlap is not smaller than size
     */
    public List<Chunk> chunk(List<Page> pages, int chunkSize, int chunkOverlap) {
        RecursiveTextSplitter splitter = new RecursiveTextSplitter(new ChunkingParameters(chunkSize, chunkOverlap));

        if (pages.isEmpty()) {
            return List.of();
        }

        String combined = pages.stream()
                .map(page -> "Page " + page.pageNumber() + ": " + page.text())
                .collect(Collectors.joining("\n\n"));

        List<String> pieces = splitter.split(combined);
        List<Chunk> chunks = new ArrayList<>(pieces.size());

        for (String piece : pieces) {
            int pageNumber = Chunk.UNKNOWN_PAGE;
            Matcher matcher = LEADING_MARKER.matcher(piece);
            if (matcher.find()) {
                pageNumber = parsePage(matcher.group(1));
            }
            String text = ANY_MARKER.matcher(piece).replaceAll("");
            chunks.add(Chunk.unattributed(chunks.size() + 1, text, pageNumber));
        }

        log.info("Split {} pages into {} chunks (size: {}, overlap: {})",
                pages.size(), chunks.size(), chunkSize, chunkOverlap);
        return chunks;
    }

    /**
     * Splits free text that has no pages, such as a long chat message.
     * Every chunk gets {@link Chunk#UNKNOWN_PAGE}.
     */
    public List<Chunk> chunkText(String text, int chunkSize, int chunkOverlap) {
        RecursiveTextSplitter splitter = new RecursiveTextSplitter(new ChunkingParameters(chunkSize, chunkOverlap));

        List<String> pieces = splitter.split(text);
        List<Chunk> chunks = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            chunks.add(Chunk.unattributed(chunks.size() + 1, piece, Chunk.UNKNOWN_PAGE));
        }
        return chunks;
    }

    private int parsePage(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // more digits than an int holds: treat as unknown
            return Chunk.UNKNOWN_PAGE;
        }
    }
}
