package com.adlanda.ragassistant.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for storing a chat message.
 *
 * @param timestamp Epoch seconds; the current time is used when absent
 */
public record MessageRequest(
        String messageId,
        String sender,
        String senderName,
        @NotBlank(message = "Message content is required")
        String content,
        Long timestamp,
        boolean isGroup
) {}
