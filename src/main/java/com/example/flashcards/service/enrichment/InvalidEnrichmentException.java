package com.example.flashcards.service.enrichment;

/**
 * The enrichment endpoint answered, but the reply does not have the expected shape.
 */
public class InvalidEnrichmentException extends RuntimeException {

    public InvalidEnrichmentException(String message) {
        super(message);
    }
}
