package com.adlanda.ragassistant.service;

import com.adlanda.ragassistant.model.DocumentFormat;
import com.adlanda.ragassistant.model.Page;
import com.adlanda.ragassistant.service.extraction.DocumentInfo;
import com.adlanda.ragassistant.service.extraction.ExtractionResult;
import com.adlanda.ragassistant.service.extraction.TextExtractor;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extractor for tests: treats the bytes as the text of a single page unless a fixed result is set.
 */
class StubTextExtractor implements TextExtractor {

    private final AtomicInteger calls = new AtomicInteger();
    private volatile ExtractionResult fixedResult;

    void willReturn(ExtractionResult result) {
        this.fixedResult = result;
    }

    int calls() {
        return calls.get();
    }

    @Override
    public ExtractionResult extract(byte[] bytes) {
        calls.incrementAndGet();
        if (fixedResult != null) {
            return fixedResult;
        }
        List<Page> pages = List.of(new Page(1, new String(bytes, StandardCharsets.UTF_8)));
        return ExtractionResult.of(pages, new DocumentInfo("Title", "Author", "", 1));
    }

    @Override
    public boolean supports(DocumentFormat format) {
        return true;
    }
}
