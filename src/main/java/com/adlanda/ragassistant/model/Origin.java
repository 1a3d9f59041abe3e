package com.adlanda.ragassistant.model;

/**
 * Fields shared by every source: who sent it and when.
 *
 * @param messageId  Id of the chat message that carried the content
 * @param senderId   Sender address or id
 * @param senderName Display name of the sender
 * @param timestamp  Epoch seconds
 * @param group      Whether the message was posted in a group chat
 */
public record Origin(
        String messageId,
        String senderId,
        String senderName,
        long timestamp,
        boolean group
) {
    public Origin {
        messageId = messageId != null ? messageId : "unknown_id";
        senderId = senderId != null ? senderId : "unknown_sender";
        senderName = senderName != null ? senderName : "Unknown";
    }
}
