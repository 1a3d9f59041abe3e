package com.adlanda.ragassistant.service.extraction;

/**
 * Document-level properties read during extraction. Strings are empty when absent.
 */
public record DocumentInfo(
        String title,
        String author,
        String subject,
        int totalPages
) {
    public DocumentInfo {
        title = title != null ? title : "";
        author = author != null ? author : "";
        subject = subject != null ? subject : "";
    }
}
