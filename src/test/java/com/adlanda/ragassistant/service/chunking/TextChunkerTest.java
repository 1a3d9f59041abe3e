package com.adlanda.ragassistant.service.chunking;

import com.adlanda.ragassistant.exception.ConfigurationException;
import com.adlanda.ragassistant.model.Chunk;
import com.adlanda.ragassistant.model.Page;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkerTest {

    private TextChunker chunker;

    @BeforeEach
    void setUp() {
        chunker = new TextChunker();
    }

    @Test
    void chunk_emptyPages_returnsEmptyList() {
        assertThat(chunker.chunk(List.of(), 1000, 100)).isEmpty();
    }

    @Test
    void chunk_overlapNotSmallerThanSize_throwsConfigurationException() {
        List<Page> pages = List.of(new Page(1, "some text"));

        assertThatThrownBy(() -> chunker.chunk(pages, 100, 100))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("overlap");
        assertThatThrownBy(() -> chunker.chunk(pages, 100, 150))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void chunk_invalidParameters_throwEvenWithoutPages() {
        assertThatThrownBy(() -> chunker.chunk(List.of(), 0, 0))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void chunk_shortPage_producesSingleChunkOnThatPage() {
        List<Chunk> chunks = chunker.chunk(List.of(new Page(3, "Short page text.")), 1000, 100);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).chunkIndex()).isEqualTo(1);
        assertThat(chunks.get(0).pageNumber()).isEqualTo(3);
        assertThat(chunks.get(0).text()).isEqualTo("Short page text.");
    }

    @Test
    void chunk_singleLongPage_producesTwoOverlappingChunks() {
        String text = wordsOfLength(1200);

        List<Chunk> chunks = chunker.chunk(List.of(new Page(1, text)), 1000, 100);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).pageNumber()).isEqualTo(1);
        // Second chunk starts mid-page, so its page is not known
        assertThat(chunks.get(1).pageNumber()).isEqualTo(Chunk.UNKNOWN_PAGE);
        assertThat(chunks.get(1).hasKnownPage()).isFalse();
        assertThat(sharedOverlap(chunks.get(0).text(), chunks.get(1).text(), 100)).isPositive();
        assertThat(chunks).extracting(Chunk::chunkIndex).containsExactly(1, 2);
    }

    @Test
    void chunk_markersAreRemovedFromText() {
        List<Chunk> chunks = chunker.chunk(List.of(
                new Page(1, "First page."),
                new Page(2, "Second page.")
        ), 1000, 100);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).text()).doesNotContain("Page 1: ").doesNotContain("Page 2: ");
        assertThat(chunks.get(0).text()).contains("First page.").contains("Second page.");
        assertThat(chunks.get(0).pageNumber()).isEqualTo(1);
    }

    @Test
    void chunk_manyPages_respectsSizeAndKeepsPagesNonDecreasing() {
        List<Page> pages = List.of(
                new Page(1, wordsOfLength(700)),
                new Page(2, wordsOfLength(900)),
                new Page(5, wordsOfLength(300)),
                new Page(6, wordsOfLength(1500))
        );

        List<Chunk> chunks = chunker.chunk(pages, 500, 50);

        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.text().length()).isLessThanOrEqualTo(500));
        int lastKnownPage = 0;
        for (Chunk chunk : chunks) {
            if (chunk.hasKnownPage()) {
                assertThat(chunk.pageNumber()).isGreaterThanOrEqualTo(lastKnownPage);
                lastKnownPage = chunk.pageNumber();
            }
        }
        assertThat(chunks).extracting(Chunk::pageNumber).contains(1, 2, 5, 6);
    }

    @Test
    void chunk_isDeterministic() {
        List<Page> pages = List.of(new Page(1, wordsOfLength(2500)), new Page(2, wordsOfLength(800)));

        assertThat(chunker.chunk(pages, 400, 60)).isEqualTo(chunker.chunk(pages, 400, 60));
    }

    @Test
    void chunkText_longMessage_splitsWithoutPages() {
        List<Chunk> chunks = chunker.chunkText(wordsOfLength(2500), 1000, 100);

        assertThat(chunks).hasSizeGreaterThan(2);
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.pageNumber()).isEqualTo(Chunk.UNKNOWN_PAGE);
            assertThat(chunk.text().length()).isLessThanOrEqualTo(1000);
        });
    }

    @Test
    void chunkText_shortMessage_keepsItWhole() {
        List<Chunk> chunks = chunker.chunkText("  Meeting moved to 3pm.  ", 1000, 100);

        assertThat(chunks).extracting(Chunk::text).containsExactly("Meeting moved to 3pm.");
    }

    static String wordsOfLength(int length) {
        String[] words = {"lorem", "ipsum", "dolor", "sit", "amet", "consectetur", "adipiscing", "elit"};
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (builder.length() < length) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(words[i++ % words.length]);
        }
        return builder.substring(0, length).strip();
    }

    /**
     * Length of the longest prefix of {@code next} (at most {@code max}) that ends {@code previous}.
     */
    static int sharedOverlap(String previous, String next, int max) {
        for (int k = Math.min(max, next.length()); k > 0; k--) {
            if (previous.endsWith(next.substring(0, k))) {
                return k;
            }
        }
        return 0;
    }
}
