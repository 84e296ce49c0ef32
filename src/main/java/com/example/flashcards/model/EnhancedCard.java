package com.example.flashcards.model;

/**
 * Original card combined with its generated example sentences.
 */
public record EnhancedCard(
    String front,
    String back,
    String deckName,
    String exampleSentenceFront,
    String exampleSentenceBack
) {

    public static EnhancedCard of(RawCard card, AdditionalFields fields) {
        return new EnhancedCard(
                card.front(),
                card.back(),
                card.deckName(),
                fields.exampleSentenceFront(),
                fields.exampleSentenceBack()
        );
    }
}
