package com.example.flashcards.service.csv;

/**
 * A deck CSV could not be read or written.
 */
public class CardCsvException extends RuntimeException {

    public CardCsvException(String message, Throwable cause) {
        super(message, cause);
    }
}
