package com.adlanda.ragassistant.model;

import java.util.Map;

/**
 * A stored chunk containing a searched term.
 *
 * @param source   Provenance label, e.g. {@code Document: report.pdf, page 2}
 * @param context  Text surrounding the first occurrence of the term
 * @param content  Full chunk text
 * @param metadata Flat chunk metadata
 */
public record TermMatch(
        String source,
        String context,
        String content,
        Map<String, Object> metadata
) {}
