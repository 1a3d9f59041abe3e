package com.adlanda.ragassistant.model;

/**
 * Answer produced by the query pipeline.
 *
 * @param answer   Generated answer text
 * @param query    The question that was asked
 * @param grounded True when at least one chunk was retrieved as context
 * @param sources  Number of chunks placed in the context
 */
public record QueryAnswer(
        String answer,
        String query,
        boolean grounded,
        int sources
) {}
