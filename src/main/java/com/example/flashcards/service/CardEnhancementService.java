package com.example.flashcards.service;

import com.example.flashcards.config.BatchMetrics;
import com.example.flashcards.executor.BatchConfig;
import com.example.flashcards.executor.BatchExecutor;
import com.example.flashcards.executor.RunCancellation;
import com.example.flashcards.model.AdditionalFields;
import com.example.flashcards.model.EnhancedCard;
import com.example.flashcards.model.EnhancementReport;
import com.example.flashcards.model.FailedCard;
import com.example.flashcards.model.RawCard;
import com.example.flashcards.model.RunResult;
import com.example.flashcards.model.UnitOutcome;
import com.example.flashcards.model.WorkItem;
import com.example.flashcards.service.csv.CardCsvException;
import com.example.flashcards.service.csv.CardCsvReader;
import com.example.flashcards.service.csv.CardCsvWriter;
import com.example.flashcards.service.enrichment.CardEnrichmentClient;
import com.example.flashcards.service.prompt.CardPromptBuilder;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Enhances flashcard decks.
 *
 * Per file:
 * 1. CardCsvReader      - read cards (optionally limited)
 * 2. BatchExecutor      - enrich each card with bounded concurrency and retries
 * 3. CardCsvWriter      - write enhanced cards in input order
 * 4. FailedCardPublisher - write and log the cards that failed
 */
@Service
@Slf4j
public class CardEnhancementService {

    static final String RUN_ID = "runId";

    private final CardCsvReader csvReader;
    private final CardCsvWriter csvWriter;
    private final CardPromptBuilder promptBuilder;
    private final CardEnrichmentClient enrichmentClient;
    private final FailedCardPublisher failedCardPublisher;
    private final BatchExecutor batchExecutor;
    private final BatchConfig batchConfig;
    private final BatchMetrics metrics;

    private final Set<RunCancellation> activeRuns = ConcurrentHashMap.newKeySet();

    public CardEnhancementService(
            CardCsvReader csvReader,
            CardCsvWriter csvWriter,
            CardPromptBuilder promptBuilder,
            CardEnrichmentClient enrichmentClient,
            FailedCardPublisher failedCardPublisher,
            BatchExecutor batchExecutor,
            BatchConfig batchConfig,
            BatchMetrics metrics) {
        this.csvReader = csvReader;
        this.csvWriter = csvWriter;
        this.promptBuilder = promptBuilder;
        this.enrichmentClient = enrichmentClient;
        this.failedCardPublisher = failedCardPublisher;
        this.batchExecutor = batchExecutor;
        this.batchConfig = batchConfig;
        this.metrics = metrics;
    }

    /**
     * Enhance every *.csv file of a directory, in file name order. A file that cannot
     * be read or written is reported with its error and the remaining files still run.
     */
    public List<EnhancementReport> enhanceDirectory(Path inputDir, Path outputDir) {
        if (!Files.isDirectory(inputDir)) {
            throw new IllegalArgumentException("Directory not found: " + inputDir);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(inputDir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".csv"))
                    .filter(p -> !p.getFileName().toString().endsWith(".failed.csv"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + inputDir, e);
        }

        log.info("Found {} deck files in {}", files.size(), inputDir);
        List<EnhancementReport> reports = new ArrayList<>();
        for (Path file : files) {
            long fileStart = System.currentTimeMillis();
            try {
                reports.add(enhanceFile(file, outputDir.resolve(file.getFileName()), null));
            } catch (CardCsvException e) {
                log.error("Skipping {}: {}", file.getFileName(), e.getMessage(), e);
                reports.add(EnhancementReport.unprocessable(
                        file.toString(), e.getMessage(), System.currentTimeMillis() - fileStart));
            }
        }
        long skipped = reports.stream().filter(r -> !r.isProcessed()).count();
        if (skipped > 0) {
            log.warn("{} of {} deck files in {} could not be processed", skipped, files.size(), inputDir);
        }
        return reports;
    }

    /**
     * Enhance one deck file.
     *
     * @param input  deck CSV with Front, Back, deck_name columns
     * @param output enhanced CSV; failures go to the matching .failed.csv
     * @param limit  optional maximum number of cards to process
     */
    public EnhancementReport enhanceFile(Path input, Path output, Integer limit) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID, runId);
        RunCancellation cancellation = new RunCancellation();
        activeRuns.add(cancellation);
        try {
            long startTime = System.currentTimeMillis();
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("ENHANCE START: {} -> {}", input, output);
            log.info("═══════════════════════════════════════════════════════════════");

            List<RawCard> cards = csvReader.read(input, limit);
            if (cards.isEmpty()) {
                log.warn("No cards found in {}", input);
                return EnhancementReport.empty(input.toString());
            }

            long runStart = System.currentTimeMillis();
            RunResult<EnhancedCard> result = batchExecutor.execute(
                    WorkItem.indexAll(cards), this::enhanceCard, batchConfig, cancellation);
            metrics.recordRunTime(System.currentTimeMillis() - runStart);

            List<EnhancedCard> enhanced = result.successes().stream()
                    .map(success -> success.value())
                    .toList();
            csvWriter.writeEnhanced(output, enhanced);

            List<FailedCard> failedCards = result.failures().stream()
                    .map(f -> FailedCard.from(cards.get(f.itemIndex()), f))
                    .toList();
            failedCardPublisher.publish(FailedCardPublisher.failuresFileFor(output), failedCards);

            long totalTime = System.currentTimeMillis() - startTime;
            metrics.recordFileTime(totalTime);
            EnhancementReport report = EnhancementReport.from(input.toString(), result, totalTime);

            log.info("═══════════════════════════════════════════════════════════════");
            log.info("ENHANCE COMPLETE: {} | Total: {}ms", input.getFileName(), totalTime);
            log.info("  Cards: {} | Enhanced: {} | Failed: {}", report.total(), report.succeeded(), report.failed());
            log.info("═══════════════════════════════════════════════════════════════");
            return report;
        } finally {
            activeRuns.remove(cancellation);
            MDC.remove(RUN_ID);
        }
    }

    /**
     * Cancel every run in progress. Cards not finished yet are reported as failed.
     *
     * @return number of runs that were signalled
     */
    public int cancelActiveRuns() {
        int count = 0;
        for (RunCancellation run : activeRuns) {
            run.cancel();
            count++;
        }
        log.info("Cancelled {} active runs", count);
        return count;
    }

    public int activeRunCount() {
        return activeRuns.size();
    }

    private EnhancedCard enhanceCard(WorkItem<RawCard> item) {
        RawCard card = item.value();
        AdditionalFields fields = enrichmentClient.enrich(promptBuilder.instructions(), promptBuilder.build(card));
        log.debug("Card {} '{}' -> '{}'", item.index(), card.front(), fields.exampleSentenceFront());
        return EnhancedCard.of(card, fields);
    }
}
