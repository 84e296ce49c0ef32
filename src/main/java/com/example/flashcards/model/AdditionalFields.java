package com.example.flashcards.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fields generated by the enrichment endpoint for one card.
 *
 * exampleSentenceFront - example sentence using the front word/phrase, in the front language
 * exampleSentenceBack  - translation of that sentence in the back language
 */
public record AdditionalFields(
    @JsonProperty("example_sentence_front") String exampleSentenceFront,
    @JsonProperty("example_sentence_back") String exampleSentenceBack
) {}
