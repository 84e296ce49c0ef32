package com.example.flashcards.service.csv;

import com.example.flashcards.model.RawCard;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads flashcards from a CSV whose header contains Front, Back and deck_name.
 * Column order does not matter and extra columns are ignored.
 */
@Component
@Slf4j
public class CardCsvReader {

    static final String FRONT = "Front";
    static final String BACK = "Back";
    static final String DECK_NAME = "deck_name";

    public List<RawCard> read(Path path) {
        return read(path, null);
    }

    /**
     * Read cards in file order, stopping after {@code limit} cards when a positive limit is given.
     * Rows too short to hold every required column are skipped.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws CardCsvException         if the file cannot be parsed or lacks a required column
     */
    public List<RawCard> read(Path path, Integer limit) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("File not found: " + path);
        }

        List<RawCard> cards = new ArrayList<>();
        int lineNumber = 1;
        try (Reader fileReader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(fileReader)) {
            String[] header = reader.readNext();
            if (header == null) {
                log.warn("{} is empty", path);
                return List.of();
            }
            List<String> columns = Arrays.stream(header).map(String::trim).map(CardCsvReader::stripBom).toList();
            int frontIdx = requireColumn(columns, FRONT, path);
            int backIdx = requireColumn(columns, BACK, path);
            int deckIdx = requireColumn(columns, DECK_NAME, path);
            int minLength = Math.max(frontIdx, Math.max(backIdx, deckIdx)) + 1;

            String[] line;
            while ((line = reader.readNext()) != null) {
                lineNumber++;
                if (line.length < minLength) {
                    log.warn("{} line {}: expected at least {} columns, got {}, skipping",
                            path.getFileName(), lineNumber, minLength, line.length);
                    continue;
                }
                cards.add(new RawCard(line[frontIdx], line[backIdx], line[deckIdx]));
                if (limit != null && limit > 0 && cards.size() >= limit) {
                    break;
                }
            }
        } catch (IOException | CsvValidationException e) {
            throw new CardCsvException("Failed to read cards from " + path + " near line " + lineNumber, e);
        }

        log.info("Read {} cards from {}", cards.size(), path);
        return cards;
    }

    private static int requireColumn(List<String> columns, String name, Path path) {
        int index = columns.indexOf(name);
        if (index < 0) {
            throw new CardCsvException("Missing column '" + name + "' in " + path + ", header was " + columns, null);
        }
        return index;
    }

    private static String stripBom(String column) {
        return column.startsWith("\uFEFF") ? column.substring(1) : column;
    }
}
