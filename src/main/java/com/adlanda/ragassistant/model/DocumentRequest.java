package com.adlanda.ragassistant.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for ingesting a document sent through chat.
 *
 * @param documentData Base64-encoded file bytes ({@code pdfData} is accepted for older clients)
 * @param fileName     Original file name; its extension selects the extractor
 * @param timestamp    Epoch seconds; the current time is used when absent
 */
public record DocumentRequest(
        String messageId,
        String sender,
        String senderName,
        @JsonAlias("pdfData")
        @NotBlank(message = "No document data provided")
        String documentData,
        @NotBlank(message = "File name is required")
        String fileName,
        Long timestamp,
        boolean isGroup
) {}
