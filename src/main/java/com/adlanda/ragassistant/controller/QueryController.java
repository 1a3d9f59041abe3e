package com.adlanda.ragassistant.controller;

import com.adlanda.ragassistant.model.QueryAnswer;
import com.adlanda.ragassistant.model.QueryRequest;
import com.adlanda.ragassistant.service.QueryService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for asking questions.
 */
@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Answer a question from the stored messages and documents.
     *
     * @param request The query request containing the question
     * @return The generated answer with grounding information
     */
    @PostMapping("/query")
    public ResponseEntity<QueryAnswer> query(@Valid @RequestBody QueryRequest request) {
        return ResponseEntity.ok(queryService.answer(request.query()));
    }
}
