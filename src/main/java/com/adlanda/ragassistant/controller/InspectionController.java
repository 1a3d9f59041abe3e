package com.adlanda.ragassistant.controller;

import com.adlanda.ragassistant.model.ChunkView;
import com.adlanda.ragassistant.model.SearchHit;
import com.adlanda.ragassistant.model.SourceSummary;
import com.adlanda.ragassistant.model.StoreStats;
import com.adlanda.ragassistant.model.TermMatch;
import com.adlanda.ragassistant.service.InspectionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for inspecting what has been ingested.
 */
@RestController
@RequestMapping("/api/v1")
public class InspectionController {

    private final InspectionService inspectionService;

    public InspectionController(InspectionService inspectionService) {
        this.inspectionService = inspectionService;
    }

    @GetMapping("/sources")
    public ResponseEntity<List<SourceSummary>> listSources(@RequestParam(required = false) String fileName) {
        return ResponseEntity.ok(inspectionService.listSources(fileName));
    }

    @GetMapping("/documents/{fileName}/chunks")
    public ResponseEntity<List<ChunkView>> viewDocument(@PathVariable String fileName) {
        return ResponseEntity.ok(inspectionService.viewDocument(fileName));
    }

    @GetMapping("/find")
    public ResponseEntity<List<TermMatch>> findTerm(@RequestParam String term) {
        return ResponseEntity.ok(inspectionService.findTerm(term));
    }

    @GetMapping("/search")
    public ResponseEntity<List<SearchHit>> search(@RequestParam String query,
                                                  @RequestParam(defaultValue = "5") int topK) {
        return ResponseEntity.ok(inspectionService.search(query, topK));
    }

    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        return ResponseEntity.ok(inspectionService.stats());
    }
}
