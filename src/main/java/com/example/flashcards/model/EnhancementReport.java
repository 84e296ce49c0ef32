package com.example.flashcards.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of enhancing one deck file.
 *
 * @param error why the file could not be processed at all, or {@code null}
 */
public record EnhancementReport(
        String file,
        int total,
        int succeeded,
        int retriedThenSucceeded,
        int failed,
        int batchesFailed,
        long elapsedMs,
        String error
) {

    public static EnhancementReport from(String file, RunResult<?> result, long elapsedMs) {
        return new EnhancementReport(
                file,
                result.total(),
                result.succeeded(),
                result.retriedThenSucceeded(),
                result.failed(),
                result.batchesFailed(),
                elapsedMs,
                null
        );
    }

    public static EnhancementReport empty(String file) {
        return new EnhancementReport(file, 0, 0, 0, 0, 0, 0, null);
    }

    public static EnhancementReport unprocessable(String file, String error, long elapsedMs) {
        return new EnhancementReport(file, 0, 0, 0, 0, 0, elapsedMs, error);
    }

    public boolean isProcessed() {
        return error == null;
    }

    public Map<String, Object> toDetailedMap() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("file", file);
        details.put("total", total);
        details.put("succeeded", succeeded);
        details.put("retriedThenSucceeded", retriedThenSucceeded);
        details.put("failed", failed);
        details.put("batchesFailed", batchesFailed);
        details.put("successRate", total > 0 ? String.format("%.1f%%", (succeeded * 100.0) / total) : "N/A");
        details.put("elapsedMs", elapsedMs);
        if (error != null) {
            details.put("error", error);
        }
        return details;
    }
}
