package com.adlanda.ragassistant.exception;

import java.time.Instant;

/**
 * Structured error body returned for every failed request.
 *
 * @param errorId   Unique id, also written to the log for correlation
 * @param kind      Machine-readable failure category
 * @param message   Human-readable description
 * @param path      Request path that failed
 * @param timestamp When the error was produced
 */
public record ApiError(
        String errorId,
        ErrorKind kind,
        String message,
        String path,
        Instant timestamp
) {}
