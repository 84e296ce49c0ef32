package com.example.flashcards;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Flashcard Enhancer Application.
 *
 * Adds generated example sentences to flashcard decks. Each card is one call to
 * the enrichment endpoint, run through the batch executor with bounded
 * concurrency, retries and per-batch failure isolation.
 */
@SpringBootApplication
public class FlashcardEnhancerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlashcardEnhancerApplication.class, args);
    }
}
