package com.adlanda.ragassistant.service;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Service for computing content hashes.
 *
 * Used for change detection in incremental ingestion: a document re-sent with
 * the same file name and the same hash is skipped.
 */
@Service
public class ContentHashService {

    /**
     * Computes the SHA-256 hash of raw document bytes.
     *
     * @return Hexadecimal string representation of the hash (64 characters)
     */
    public String computeHash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Computes the SHA-256 hash of a string's UTF-8 bytes.
     */
    public String computeHash(String content) {
        return computeHash(content.getBytes(StandardCharsets.UTF_8));
    }
}
