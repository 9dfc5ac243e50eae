package com.tokenwatch.indexer.controller;

import com.tokenwatch.indexer.modules.indexer.IndexerStatus;
import com.tokenwatch.indexer.modules.indexer.TransferIndexer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Manual trigger and status of the indexing engine.
 */
@Slf4j
@RestController
@RequestMapping("/api/indexer")
@RequiredArgsConstructor
public class IndexerController {

    private final TransferIndexer transferIndexer;

    /**
     * Start one indexing cycle in the background.
     *
     * POST /api/indexer/run
     */
    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> triggerCycle() {
        log.info("Received request to trigger an indexing cycle");

        boolean started = transferIndexer.triggerAsync("manual");

        Map<String, Object> response = new HashMap<>();
        response.put("success", started);
        response.put("message", started ? "Indexing cycle started in background" : "Indexing cycle already running");
        response.put("timestamp", System.currentTimeMillis());

        return ResponseEntity.status(started ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT).body(response);
    }

    /**
     * GET /api/indexer/status
     */
    @GetMapping("/status")
    public IndexerStatus getStatus() {
        return transferIndexer.status();
    }
}
