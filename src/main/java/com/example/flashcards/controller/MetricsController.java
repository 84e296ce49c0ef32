package com.example.flashcards.controller;

import com.example.flashcards.config.BatchMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST endpoint for a summary of enrichment metrics.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final BatchMetrics batchMetrics;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("items", getItemMetrics());
        response.put("timing", getTimingMetrics());

        return response;
    }

    @GetMapping("/items")
    public Map<String, Object> getItemMetrics() {
        Map<String, Object> items = new LinkedHashMap<>();

        double succeeded = batchMetrics.getItemsSucceededCounter().count();
        double failed = batchMetrics.getItemsFailedCounter().count();
        double total = succeeded + failed;

        items.put("total", (long) total);
        items.put("succeeded", (long) succeeded);
        items.put("failed", (long) failed);
        items.put("retries", (long) batchMetrics.getUnitRetryCounter().count());
        items.put("exhausted", (long) batchMetrics.getUnitExhaustedCounter().count());
        items.put("batchesFailed", (long) batchMetrics.getBatchFailedCounter().count());
        items.put("runs", (long) batchMetrics.getRunsCompletedCounter().count());

        if (total > 0) {
            items.put("successRate", String.format("%.2f%%", (succeeded / total) * 100));
        } else {
            items.put("successRate", "N/A");
        }

        return items;
    }

    @GetMapping("/timing")
    public Map<String, Object> getTimingMetrics() {
        Map<String, Object> timing = new LinkedHashMap<>();

        timing.put("run", getTimerStats(batchMetrics.getRunTimer()));
        timing.put("file", getTimerStats(batchMetrics.getFileTimer()));

        return timing;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }

        return stats;
    }
}
