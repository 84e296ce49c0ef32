package com.example.flashcards.service;

import com.example.flashcards.model.FailedCard;
import com.example.flashcards.service.csv.CardCsvException;
import com.example.flashcards.service.csv.CardCsvWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Dead-letter step: logs cards that could not be enhanced and writes them next to
 * the enhanced output so they can be re-run later. A run without failures removes
 * the failures file of an earlier run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FailedCardPublisher {

    private final CardCsvWriter csvWriter;

    public void publish(Path failuresFile, List<FailedCard> failedCards) {
        if (failedCards.isEmpty()) {
            removeStale(failuresFile);
            return;
        }

        log.warn("{} cards could not be enhanced, writing them to {}", failedCards.size(), failuresFile);
        for (FailedCard failed : failedCards) {
            log.warn("  FAILED: '{}' after {} attempts - {} ({})",
                    failed.card().front(),
                    failed.attempts(),
                    failed.reason(),
                    failed.exceptionType());
        }
        csvWriter.writeFailed(failuresFile, failedCards);
    }

    private void removeStale(Path failuresFile) {
        try {
            if (Files.deleteIfExists(failuresFile)) {
                log.info("No failed cards, removed stale {}", failuresFile);
            }
        } catch (IOException e) {
            throw new CardCsvException("Failed to remove stale failures file " + failuresFile, e);
        }
    }

    /**
     * {@code deck.csv} becomes {@code deck.failed.csv} in the same directory.
     */
    public static Path failuresFileFor(Path outputFile) {
        String name = outputFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return outputFile.resolveSibling(stem + ".failed.csv");
    }
}
