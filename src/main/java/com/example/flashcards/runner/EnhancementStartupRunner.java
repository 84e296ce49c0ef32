package com.example.flashcards.runner;

import com.example.flashcards.model.EnhancementReport;
import com.example.flashcards.service.CardEnhancementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Enhances every deck of app.enhance.input-dir into app.enhance.output-dir at startup.
 * Enabled with app.enhance.on-startup=true.
 */
@Component
@ConditionalOnProperty(name = "app.enhance.on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class EnhancementStartupRunner implements ApplicationRunner {

    private final CardEnhancementService enhancementService;

    @Value("${app.enhance.input-dir:output/base}")
    private String inputDir;

    @Value("${app.enhance.output-dir:output/enhanced}")
    private String outputDir;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Startup enhancement: {} -> {}", inputDir, outputDir);
        List<EnhancementReport> reports = enhancementService.enhanceDirectory(Path.of(inputDir), Path.of(outputDir));
        int failed = reports.stream().mapToInt(EnhancementReport::failed).sum();
        int succeeded = reports.stream().mapToInt(EnhancementReport::succeeded).sum();
        long skipped = reports.stream().filter(r -> !r.isProcessed()).count();
        log.info("Startup enhancement finished: {} files ({} skipped), {} cards enhanced, {} failed",
                reports.size(), skipped, succeeded, failed);
    }
}
