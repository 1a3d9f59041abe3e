package com.adlanda.ragassistant.model;

/**
 * Provenance of a plain chat message.
 */
public record MessageSource(Origin origin) implements SourceMetadata {

    @Override
    public String sourceKey() {
        return origin.messageId();
    }
}
