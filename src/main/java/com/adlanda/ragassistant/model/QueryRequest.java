package com.adlanda.ragassistant.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the query endpoint.
 */
public record QueryRequest(
        @NotBlank(message = "No query provided")
        String query
) {}
