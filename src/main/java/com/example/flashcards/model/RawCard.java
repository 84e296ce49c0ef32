package com.example.flashcards.model;

/**
 * Flashcard as read from the source deck CSV.
 */
public record RawCard(
    String front,
    String back,
    String deckName
) {}
