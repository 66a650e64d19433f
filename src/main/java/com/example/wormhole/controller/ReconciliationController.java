package com.example.wormhole.controller;

import com.example.wormhole.model.PipelineReport;
import com.example.wormhole.model.ScanReport;
import com.example.wormhole.model.UserMapping;
import com.example.wormhole.model.WorkItem;
import com.example.wormhole.orchestrator.VerificationPipeline;
import com.example.wormhole.service.MappingLookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for pipeline runs and mapping lookups.
 */
@RestController
@RequestMapping("/api")
public class ReconciliationController {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationController.class);

    private final VerificationPipeline pipeline;
    private final MappingLookupService lookupService;

    public ReconciliationController(VerificationPipeline pipeline, MappingLookupService lookupService) {
        this.pipeline = pipeline;
        this.lookupService = lookupService;
    }

    /**
     * Verifies a batch of pairs, persists the confirmed ones and rebuilds both indexes.
     *
     * <p>Endpoint: POST /api/pipeline/verify
     * <p>Body: [{"bilibiliUid": "...", "youtubeChannelId": "...", "issueNumber": 1}]
     */
    @PostMapping(value = "/pipeline/verify", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> verify(@RequestBody List<WorkItem> items) {
        if (items == null || items.isEmpty()) {
            return badRequest("No work items supplied.");
        }
        if (items.stream().anyMatch(i -> i == null || i.bilibiliUid() == null || i.bilibiliUid().isBlank())) {
            return badRequest("Every work item needs a bilibiliUid.");
        }
        log.info("Received verification request for {} items", items.size());
        try {
            PipelineReport report = pipeline.verifyBatch(items);
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            log.error("Verification run failed", e);
            return serverError("Error during verification run", e);
        }
    }

    /**
     * Scans the Bilibili ranked lists for creators without a mapping.
     *
     * <p>Endpoint: POST /api/pipeline/scan
     */
    @PostMapping(value = "/pipeline/scan", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> scan() {
        try {
            ScanReport report = pipeline.scan();
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            log.error("Scan failed", e);
            return serverError("Error during scan", e);
        }
    }

    @GetMapping("/mappings/bilibili/{uid}")
    public ResponseEntity<UserMapping> byBilibiliUid(@PathVariable String uid) {
        return lookupService.findByBilibiliUid(uid)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/mappings/youtube/{channelId}")
    public ResponseEntity<UserMapping> byYouTubeChannelId(@PathVariable String channelId) {
        return lookupService.findByYouTubeChannelId(channelId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "BiliTube-Wormhole"
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private ResponseEntity<Map<String, String>> serverError(String error, Exception e) {
        return ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", error,
                        "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                ));
    }
}
