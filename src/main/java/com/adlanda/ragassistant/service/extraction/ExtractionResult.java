package com.adlanda.ragassistant.service.extraction;

import com.adlanda.ragassistant.model.Page;

import java.util.List;

/**
 * Outcome of extracting text from a document.
 *
 * <ul>
 *   <li>{@link Extracted}: at least one page of text</li>
 *   <li>{@link Empty}: the document parsed but holds no text, e.g. a scanned PDF</li>
 *   <li>{@link Failed}: the document could not be parsed</li>
 * </ul>
 */
public sealed interface ExtractionResult
        permits ExtractionResult.Extracted, ExtractionResult.Empty, ExtractionResult.Failed {

    record Extracted(List<Page> pages, DocumentInfo info) implements ExtractionResult {
        public Extracted {
            if (pages.isEmpty()) {
                throw new IllegalArgumentException("Extracted result needs at least one page");
            }
            pages = List.copyOf(pages);
        }
    }

    record Empty(DocumentInfo info) implements ExtractionResult {}

    record Failed(String reason, Throwable cause) implements ExtractionResult {}

    static ExtractionResult of(List<Page> pages, DocumentInfo info) {
        return pages.isEmpty() ? new Empty(info) : new Extracted(pages, info);
    }
}
