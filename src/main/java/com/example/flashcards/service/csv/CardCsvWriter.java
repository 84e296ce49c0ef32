package com.example.flashcards.service.csv;

import com.example.flashcards.model.EnhancedCard;
import com.example.flashcards.model.FailedCard;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes enhanced cards and failed cards as CSV, creating parent directories as needed.
 */
@Component
@Slf4j
public class CardCsvWriter {

    static final String[] ENHANCED_HEADER = {
            "front", "back", "deck_name", "example_sentence_front", "example_sentence_back"
    };

    static final String[] FAILED_HEADER = {
            "front", "back", "deck_name", "reason", "exception_type", "attempts"
    };

    public void writeEnhanced(Path path, List<EnhancedCard> cards) {
        try (ICSVWriter writer = open(path)) {
            writer.writeNext(ENHANCED_HEADER);
            for (EnhancedCard card : cards) {
                writer.writeNext(new String[] {
                        card.front(),
                        card.back(),
                        card.deckName(),
                        card.exampleSentenceFront(),
                        card.exampleSentenceBack()
                });
            }
        } catch (IOException e) {
            throw new CardCsvException("Failed to write enhanced cards to " + path, e);
        }
        log.info("Wrote {} enhanced cards to {}", cards.size(), path);
    }

    public void writeFailed(Path path, List<FailedCard> failures) {
        try (ICSVWriter writer = open(path)) {
            writer.writeNext(FAILED_HEADER);
            for (FailedCard failed : failures) {
                writer.writeNext(new String[] {
                        failed.card().front(),
                        failed.card().back(),
                        failed.card().deckName(),
                        failed.reason(),
                        failed.exceptionType(),
                        String.valueOf(failed.attempts())
                });
            }
        } catch (IOException e) {
            throw new CardCsvException("Failed to write failed cards to " + path, e);
        }
        log.info("Wrote {} failed cards to {}", failures.size(), path);
    }

    private ICSVWriter open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Writer fileWriter = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        return new CSVWriter(fileWriter, ICSVWriter.DEFAULT_SEPARATOR, ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n");
    }
}
