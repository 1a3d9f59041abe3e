package com.adlanda.ragassistant.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ContentHashService.
 * Tests SHA-256 hash computation for document change detection.
 */
class ContentHashServiceTest {

    private ContentHashService hashService;

    @BeforeEach
    void setUp() {
        hashService = new ContentHashService();
    }

    @Test
    void computeHash_sameContent_returnsSameHash() {
        assertThat(hashService.computeHash(new byte[]{1, 2, 3}))
                .isEqualTo(hashService.computeHash(new byte[]{1, 2, 3}));
    }

    @Test
    void computeHash_differentContent_returnsDifferentHash() {
        assertThat(hashService.computeHash("hello world"))
                .isNotEqualTo(hashService.computeHash("hello universe"));
    }

    @Test
    void computeHash_returnsValidSha256Format() {
        assertThat(hashService.computeHash("test content"))
                .hasSize(64)  // SHA-256 produces 64 hex characters
                .matches("[a-f0-9]+");
    }

    @Test
    void computeHash_emptyContent_returnsWellKnownHash() {
        assertThat(hashService.computeHash(new byte[0]))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void computeHash_stringMatchesItsUtf8Bytes() {
        String content = "Laporan kewangan – suku ketiga";

        assertThat(hashService.computeHash(content))
                .isEqualTo(hashService.computeHash(content.getBytes(StandardCharsets.UTF_8)));
    }
}
