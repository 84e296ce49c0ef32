package com.example.flashcards.controller;

import com.example.flashcards.model.EnhancementReport;
import com.example.flashcards.service.CardEnhancementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints to run and cancel deck enhancement.
 *
 * POST /api/enhance            - one file
 * POST /api/enhance/directory  - every *.csv in a directory
 * POST /api/enhance/cancel     - cancel runs in progress
 */
@RestController
@RequestMapping("/api/enhance")
@RequiredArgsConstructor
@Slf4j
public class EnhancementController {

    private final CardEnhancementService enhancementService;

    @PostMapping
    public ResponseEntity<EnhancementReport> enhanceFile(@RequestBody FileRequest request) {
        if (request.input() == null || request.output() == null) {
            throw new IllegalArgumentException("input and output are required");
        }
        EnhancementReport report = enhancementService.enhanceFile(
                Path.of(request.input()), Path.of(request.output()), request.limit());
        return ResponseEntity.ok(report);
    }

    @PostMapping("/directory")
    public ResponseEntity<List<Map<String, Object>>> enhanceDirectory(@RequestBody DirectoryRequest request) {
        if (request.inputDir() == null || request.outputDir() == null) {
            throw new IllegalArgumentException("inputDir and outputDir are required");
        }
        List<EnhancementReport> reports = enhancementService.enhanceDirectory(
                Path.of(request.inputDir()), Path.of(request.outputDir()));
        return ResponseEntity.ok(reports.stream().map(EnhancementReport::toDetailedMap).toList());
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        int cancelled = enhancementService.cancelActiveRuns();
        return ResponseEntity.ok(Map.of("cancelledRuns", cancelled));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected enhancement request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    /** Request body for POST /api/enhance. */
    public record FileRequest(String input, String output, Integer limit) {}

    /** Request body for POST /api/enhance/directory. */
    public record DirectoryRequest(String inputDir, String outputDir) {}
}
