package com.adlanda.ragassistant.service;

import com.adlanda.ragassistant.exception.NotFoundException;
import com.adlanda.ragassistant.exception.ValidationException;
import com.adlanda.ragassistant.model.ChunkView;
import com.adlanda.ragassistant.model.SearchHit;
import com.adlanda.ragassistant.model.SourceSummary;
import com.adlanda.ragassistant.model.StoreStats;
import com.adlanda.ragassistant.model.TermMatch;
import com.adlanda.ragassistant.repository.InMemoryChunkStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.document.Document;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InspectionServiceTest {

    private InMemoryChunkStore store;
    private InspectionService service;

    @BeforeEach
    void setUp() {
        EmbeddingService embeddingService = mock(EmbeddingService.class);
        when(embeddingService.embedAll(anyList())).thenAnswer(inv -> {
            List<String> texts = inv.getArgument(0);
            return texts.stream().map(InspectionServiceTest::vector).toList();
        });
        when(embeddingService.embed(anyString())).thenAnswer(inv -> vector(inv.getArgument(0)));
        store = new InMemoryChunkStore(embeddingService);
        service = new InspectionService(store);

        store.add(List.of(
                document("d1", "Budget approved for the new warehouse.", "plan.pdf", "pdf", 2, 2, 200L),
                document("d2", "Warehouse opening planned for June.", "plan.pdf", "pdf", 1, 1, 200L),
                document("d3", "Intro continues here.", "plan.pdf", "pdf", 0, 3, 200L),
                document("d4", "Minutes of the board meeting.", "minutes.docx", "docx", 1, 1, 300L),
                message("m1", "Can someone send the WAREHOUSE keys?", "msg-9", 100L)));
    }

    @Test
    void listSources_groupsByDocumentAndMessage_mostRecentFirst() {
        List<SourceSummary> sources = service.listSources(null);

        assertThat(sources).extracting(SourceSummary::key).containsExactly("minutes.docx", "plan.pdf", "msg-9");
        assertThat(sources.get(1).chunks()).isEqualTo(3);
        assertThat(sources.get(1).fileType()).isEqualTo("pdf");
        assertThat(sources.get(2).sourceType()).isEqualTo("message");
        assertThat(sources.get(2).fileType()).isNull();
    }

    @Test
    void listSources_filteredByFileName() {
        assertThat(service.listSources("minutes.docx")).extracting(SourceSummary::key).containsExactly("minutes.docx");
        assertThat(service.listSources("missing.pdf")).isEmpty();
    }

    @Test
    void viewDocument_sortsByPageThenChunkIndex() {
        List<ChunkView> chunks = service.viewDocument("plan.pdf");

        assertThat(chunks).extracting(ChunkView::page).containsExactly(0, 1, 2);
        assertThat(chunks.get(1).content()).isEqualTo("Warehouse opening planned for June.");
    }

    @Test
    void viewDocument_unknownFile_throwsNotFound() {
        assertThatThrownBy(() -> service.viewDocument("missing.pdf"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("missing.pdf");
    }

    @Test
    void findTerm_isCaseInsensitiveAndLabelsSources() {
        List<TermMatch> matches = service.findTerm("warehouse");

        assertThat(matches).extracting(TermMatch::source).containsExactlyInAnyOrder(
                "Document: plan.pdf, page 2",
                "Document: plan.pdf, page 1",
                "Message from Farid (60111@chat) at 2024-01-01 09:00:00");
    }

    @Test
    void findTerm_textWhoseLowerCaseIsLonger_windowStaysOnMatch() {
        store.add(List.of(message("m2", "İ".repeat(60) + " NEEDLE", "msg-10", 50L)));

        List<TermMatch> matches = service.findTerm("needle");

        assertThat(matches).singleElement()
                .extracting(TermMatch::context)
                .isEqualTo("..." + "İ".repeat(49) + " NEEDLE");
    }

    @Test
    void listSources_sameFileNameFromTwoSenders_listedSeparately() {
        store.add(List.of(
                new Document("s1", "Alice's invoice.", Map.of("sourceType", "document", "fileName", "document.pdf",
                        "documentType", "pdf", "sender", "alice@chat", "timestamp", 400L, "page", 1, "chunkIndex", 1)),
                new Document("s2", "Bob's quotation.", Map.of("sourceType", "document", "fileName", "document.pdf",
                        "documentType", "pdf", "sender", "bob@chat", "timestamp", 500L, "page", 1, "chunkIndex", 1))));

        assertThat(service.listSources("document.pdf"))
                .extracting(SourceSummary::key)
                .containsExactly("document.pdf", "document.pdf");
    }

    @Test
    void findTerm_blankTerm_throwsValidation() {
        assertThatThrownBy(() -> service.findTerm(" ")).isInstanceOf(ValidationException.class);
    }

    @Test
    void contextWindow_marksTruncatedSides() {
        String text = "a".repeat(100) + "TERM" + "b".repeat(100);

        String context = InspectionService.contextWindow(text, 100, 4);

        assertThat(context).isEqualTo("..." + "a".repeat(50) + "TERM" + "b".repeat(50) + "...");
        assertThat(InspectionService.contextWindow("short TERM text", 6, 4)).isEqualTo("short TERM text");
    }

    @Test
    void search_returnsRankedHitsWithoutGeneration() {
        List<SearchHit> hits = service.search("Minutes of the board meeting.", 2);

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).rank()).isEqualTo(1);
        assertThat(hits.get(0).source()).isEqualTo("Document: minutes.docx, page 1");
        assertThat(hits.get(0).score()).isGreaterThanOrEqualTo(hits.get(1).score());
    }

    @Test
    void search_invalidArguments_throwValidation() {
        assertThatThrownBy(() -> service.search("", 3)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.search("q", 0)).isInstanceOf(ValidationException.class);
    }

    @Test
    void stats_countsByDocumentTypeAndMessages() {
        StoreStats stats = service.stats();

        assertThat(stats.totalChunks()).isEqualTo(5);
        assertThat(stats.documentTypes())
                .containsEntry("pdf", 3L)
                .containsEntry("docx", 1L)
                .containsEntry("doc", 0L)
                .containsEntry("message", 1L);
    }

    private static float[] vector(String text) {
        // exact text match scores highest
        return new float[]{text.hashCode() % 97, text.length(), 1f};
    }

    private static Document document(String id, String text, String fileName, String type,
                                     int page, int chunkIndex, long timestamp) {
        return new Document(id, text, Map.of(
                "sourceType", "document",
                "fileName", fileName,
                "documentType", type,
                "senderName", "Aisyah",
                "timestamp", timestamp,
                "datetime", "2024-01-01 10:00:00",
                "group", false,
                "page", page,
                "chunkIndex", chunkIndex));
    }

    private static Document message(String id, String text, String messageId, long timestamp) {
        return new Document(id, text, Map.of(
                "sourceType", "message",
                "messageId", messageId,
                "sender", "60111@chat",
                "senderName", "Farid",
                "timestamp", timestamp,
                "datetime", "2024-01-01 09:00:00",
                "group", true,
                "page", 0,
                "chunkIndex", 1));
    }
}
