package com.example.flashcards.service.enrichment;

import com.example.flashcards.model.AdditionalFields;

/**
 * Generates the additional fields for one card prompt. Calls are slow and may fail;
 * callers are expected to retry.
 */
public interface CardEnrichmentClient {

    AdditionalFields enrich(String instructions, String prompt);
}
