package com.adlanda.ragassistant.model;

/**
 * Provenance of a document attached to a chat message.
 *
 * @param origin      Who sent the document and when
 * @param fileName    Original file name as sent
 * @param format      Document format
 * @param title       Title from the document properties, empty if absent
 * @param author      Author from the document properties, empty if absent
 * @param subject     Subject from the document properties, empty if absent
 * @param totalPages  Page count (synthesized for DOCX/DOC)
 * @param contentHash SHA-256 of the raw bytes, used to skip re-ingestion of unchanged files
 */
public record DocumentSource(
        Origin origin,
        String fileName,
        DocumentFormat format,
        String title,
        String author,
        String subject,
        int totalPages,
        String contentHash
) implements SourceMetadata {

    public DocumentSource {
        title = title != null ? title : "";
        author = author != null ? author : "";
        subject = subject != null ? subject : "";
        contentHash = contentHash != null ? contentHash : "";
    }

    @Override
    public String sourceKey() {
        return origin.senderId() + "/" + fileName;
    }
}
