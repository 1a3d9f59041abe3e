package com.adlanda.ragassistant.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    /**
     * Root endpoint with API documentation links.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "RAG Assistant",
                "version", appVersion,
                "endpoints", Map.of(
                        "messages", "POST /api/v1/messages - Store a chat message",
                        "documents", "POST /api/v1/documents - Ingest a PDF, DOCX or DOC document",
                        "query", "POST /api/v1/query - Ask a question",
                        "sources", "GET /api/v1/sources - List ingested sources",
                        "chunks", "GET /api/v1/documents/{fileName}/chunks - View a document's chunks",
                        "find", "GET /api/v1/find?term= - Find chunks containing a term",
                        "search", "GET /api/v1/search?query=&topK= - Semantic search without generation",
                        "stats", "GET /api/v1/stats - Chunk counts by type",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
