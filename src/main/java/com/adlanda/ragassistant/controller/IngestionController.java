package com.adlanda.ragassistant.controller;

import com.adlanda.ragassistant.model.DocumentRequest;
import com.adlanda.ragassistant.model.IngestionReport;
import com.adlanda.ragassistant.model.MessageRequest;
import com.adlanda.ragassistant.service.IngestionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for storing chat messages and documents.
 */
@RestController
@RequestMapping("/api/v1")
public class IngestionController {

    private final IngestionService ingestionService;

    public IngestionController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/messages")
    public ResponseEntity<IngestionReport> storeMessage(@Valid @RequestBody MessageRequest request) {
        return ResponseEntity.ok(ingestionService.ingestMessage(request));
    }

    /**
     * Ingest a base64-encoded PDF, DOCX or DOC document.
     */
    @PostMapping("/documents")
    public ResponseEntity<IngestionReport> ingestDocument(@Valid @RequestBody DocumentRequest request) {
        return ResponseEntity.ok(ingestionService.ingestDocument(request));
    }
}
