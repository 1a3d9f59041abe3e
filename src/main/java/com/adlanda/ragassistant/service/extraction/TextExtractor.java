package com.adlanda.ragassistant.service.extraction;

import com.adlanda.ragassistant.model.DocumentFormat;

/**
 * Extracts page-tagged text from the raw bytes of one document format.
 */
public interface TextExtractor {

    /**
     * Extracts the pages of a document. Parse errors are reported as {@link ExtractionResult.Failed},
     * never thrown.
     *
     * @param bytes Raw document bytes, non-empty
     */
    ExtractionResult extract(byte[] bytes);

    boolean supports(DocumentFormat format);
}
