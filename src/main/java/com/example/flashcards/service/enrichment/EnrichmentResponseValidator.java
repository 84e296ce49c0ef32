package com.example.flashcards.service.enrichment;

import com.example.flashcards.model.AdditionalFields;
import org.springframework.stereotype.Component;

/**
 * Checks that a structured enrichment reply has both example sentences.
 */
@Component
public class EnrichmentResponseValidator {

    public AdditionalFields validate(AdditionalFields fields) {
        if (fields == null) {
            throw new InvalidEnrichmentException("Empty enrichment response");
        }
        if (isBlank(fields.exampleSentenceFront())) {
            throw new InvalidEnrichmentException("Missing example_sentence_front");
        }
        if (isBlank(fields.exampleSentenceBack())) {
            throw new InvalidEnrichmentException("Missing example_sentence_back");
        }
        return new AdditionalFields(fields.exampleSentenceFront().strip(), fields.exampleSentenceBack().strip());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
