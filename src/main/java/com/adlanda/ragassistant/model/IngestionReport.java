package com.adlanda.ragassistant.model;

/**
 * Outcome of one ingestion call.
 *
 * @param sourceType     {@code message} or {@code document}
 * @param sourceName     File name or message id
 * @param chunksProduced Chunks written to the store
 * @param pagesProcessed Pages extracted (0 for messages)
 * @param documentType   Document extension, null for messages
 * @param skipped        True when an identical document was already indexed
 */
public record IngestionReport(
        String sourceType,
        String sourceName,
        int chunksProduced,
        int pagesProcessed,
        String documentType,
        boolean skipped
) {
    public static IngestionReport message(String messageId, int chunks) {
        return new IngestionReport(MetadataKeys.TYPE_MESSAGE, messageId, chunks, 0, null, false);
    }

    public static IngestionReport document(String fileName, DocumentFormat format, int chunks, int pages) {
        return new IngestionReport(MetadataKeys.TYPE_DOCUMENT, fileName, chunks, pages, format.extension(), false);
    }

    public static IngestionReport unchanged(String fileName, DocumentFormat format) {
        return new IngestionReport(MetadataKeys.TYPE_DOCUMENT, fileName, 0, 0, format.extension(), true);
    }
}
