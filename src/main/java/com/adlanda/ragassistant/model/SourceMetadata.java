package com.adlanda.ragassistant.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provenance of an ingested unit: either a chat message or a document sent through chat.
 *
 * <p>Kept typed inside the application and flattened with {@link #toMap(ZoneId)} only when
 * chunks are handed to the store. {@link #fromMap(Map)} reverses the flattening on the read side.
 */
public sealed interface SourceMetadata permits MessageSource, DocumentSource {

    DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    Origin origin();

    /**
     * Stable key identifying the logical source: sender and file name for documents,
     * the message id for messages.
     */
    String sourceKey();

    /**
     * Flattens the metadata into store-friendly key/value pairs. Values are never null.
     */
    default Map<String, Object> toMap(ZoneId zone) {
        Origin origin = origin();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(MetadataKeys.SOURCE_TYPE, this instanceof DocumentSource
                ? MetadataKeys.TYPE_DOCUMENT : MetadataKeys.TYPE_MESSAGE);
        map.put(MetadataKeys.MESSAGE_ID, origin.messageId());
        map.put(MetadataKeys.SENDER, origin.senderId());
        map.put(MetadataKeys.SENDER_NAME, origin.senderName());
        map.put(MetadataKeys.TIMESTAMP, origin.timestamp());
        map.put(MetadataKeys.DATETIME, formatDatetime(origin.timestamp(), zone));
        map.put(MetadataKeys.GROUP, origin.group());

        if (this instanceof DocumentSource document) {
            map.put(MetadataKeys.FILE_NAME, document.fileName());
            map.put(MetadataKeys.DOCUMENT_TYPE, document.format().extension());
            map.put(MetadataKeys.TITLE, document.title());
            map.put(MetadataKeys.AUTHOR, document.author());
            map.put(MetadataKeys.SUBJECT, document.subject());
            map.put(MetadataKeys.TOTAL_PAGES, document.totalPages());
            map.put(MetadataKeys.CONTENT_HASH, document.contentHash());
        }
        return map;
    }

    /**
     * Rebuilds typed metadata from a stored map. Missing values fall back to defaults.
     */
    static SourceMetadata fromMap(Map<String, Object> map) {
        Origin origin = new Origin(
                string(map, MetadataKeys.MESSAGE_ID),
                string(map, MetadataKeys.SENDER),
                string(map, MetadataKeys.SENDER_NAME),
                number(map, MetadataKeys.TIMESTAMP),
                Boolean.parseBoolean(String.valueOf(map.get(MetadataKeys.GROUP)))
        );

        if (!MetadataKeys.TYPE_DOCUMENT.equals(map.get(MetadataKeys.SOURCE_TYPE))) {
            return new MessageSource(origin);
        }

        String fileName = string(map, MetadataKeys.FILE_NAME);
        String documentType = string(map, MetadataKeys.DOCUMENT_TYPE);
        return new DocumentSource(
                origin,
                fileName,
                documentType != null
                        ? DocumentFormat.fromExtension(documentType)
                        : DocumentFormat.fromFileName(fileName),
                string(map, MetadataKeys.TITLE),
                string(map, MetadataKeys.AUTHOR),
                string(map, MetadataKeys.SUBJECT),
                (int) number(map, MetadataKeys.TOTAL_PAGES),
                string(map, MetadataKeys.CONTENT_HASH)
        );
    }

    static String formatDatetime(long epochSeconds, ZoneId zone) {
        return DATETIME_FORMAT.format(Instant.ofEpochSecond(epochSeconds).atZone(zone));
    }

    private static String string(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    private static long number(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
