package com.adlanda.ragassistant.model;

/**
 * Text of one page of an extracted document.
 *
 * @param pageNumber 1-based page number, increasing within a document
 * @param text       Normalized page text, never blank
 */
public record Page(int pageNumber, String text) {

    public Page {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page number must be positive: " + pageNumber);
        }
    }
}
