package com.example.wormhole.controller;

import com.example.wormhole.client.TicketFilingException;
import com.example.wormhole.model.SubmissionRequest;
import com.example.wormhole.model.SubmissionResponse;
import com.example.wormhole.service.SubmissionRateLimitException;
import com.example.wormhole.service.SubmissionService;
import com.example.wormhole.service.SubmissionValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Accepts user-submitted pairs and files them for verification.
 */
@RestController
@RequestMapping("/api")
public class SubmissionController {

    private static final Logger log = LoggerFactory.getLogger(SubmissionController.class);

    private final SubmissionService submissionService;

    public SubmissionController(SubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    /**
     * <p>Endpoint: POST /api/submissions
     * <p>Body: {"bilibiliUid", "youtubeChannelId", "submitterEmail"?, "notes"?}
     */
    @PostMapping(value = "/submissions", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submit(@RequestBody SubmissionRequest request, HttpServletRequest httpRequest) {
        String client = clientKey(httpRequest);
        try {
            SubmissionResponse response = submissionService.submit(request, client);
            return ResponseEntity.ok(response);
        } catch (SubmissionRateLimitException e) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(Map.of("error", "Rate limit exceeded. Please try again later."));
        } catch (SubmissionValidationException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Validation failed", "details", e.errors()));
        } catch (TicketFilingException e) {
            log.error("Failed to file submission from {}", client, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to create submission. Please try again later."));
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> invalidJson(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "Invalid JSON"));
    }

    private static String clientKey(HttpServletRequest request) {
        String forwarded = request.getHeader("CF-Connecting-IP");
        if (forwarded == null || forwarded.isBlank()) {
            forwarded = request.getHeader("X-Real-IP");
        }
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.trim();
        }
        return request.getRemoteAddr() != null ? request.getRemoteAddr() : "unknown";
    }
}
