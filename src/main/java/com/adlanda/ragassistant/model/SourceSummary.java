package com.adlanda.ragassistant.model;

/**
 * One distinct source in the store, as listed by the inspection endpoints.
 *
 * @param key        File name for documents, message id for messages
 * @param sourceType {@code document} or {@code message}
 * @param fileType   Document extension, null for messages
 * @param senderName Who sent the document or message
 * @param group      Whether it was posted in a group chat
 * @param timestamp  Epoch seconds of the message that carried it
 * @param datetime   Formatted timestamp
 * @param chunks     Number of stored chunks for this source
 */
public record SourceSummary(
        String key,
        String sourceType,
        String fileType,
        String senderName,
        boolean group,
        long timestamp,
        String datetime,
        int chunks
) {}
