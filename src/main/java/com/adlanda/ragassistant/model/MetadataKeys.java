package com.adlanda.ragassistant.model;

/**
 * Keys of the flat metadata map stored alongside each chunk.
 */
public final class MetadataKeys {

    public static final String SOURCE_TYPE = "sourceType";
    public static final String MESSAGE_ID = "messageId";
    public static final String SENDER = "sender";
    public static final String SENDER_NAME = "senderName";
    public static final String TIMESTAMP = "timestamp";
    public static final String DATETIME = "datetime";
    public static final String GROUP = "group";

    public static final String FILE_NAME = "fileName";
    public static final String DOCUMENT_TYPE = "documentType";
    public static final String TITLE = "title";
    public static final String AUTHOR = "author";
    public static final String SUBJECT = "subject";
    public static final String TOTAL_PAGES = "totalPages";
    public static final String CONTENT_HASH = "contentHash";

    // chunk-specific
    public static final String PAGE = "page";
    public static final String CHUNK_INDEX = "chunkIndex";

    public static final String TYPE_MESSAGE = "message";
    public static final String TYPE_DOCUMENT = "document";

    private MetadataKeys() {
    }
}
