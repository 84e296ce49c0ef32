package com.example.flashcards.service.prompt;

import com.example.flashcards.model.RawCard;
import org.springframework.stereotype.Component;

/**
 * Builds the text sent to the enrichment endpoint for one card.
 */
@Component
public class CardPromptBuilder {

    public static final String INSTRUCTIONS =
            "You are a language learning assistant. Generate natural, contextually "
            + "appropriate example sentences for flashcard vocabulary and phrases.";

    public String instructions() {
        return INSTRUCTIONS;
    }

    public String build(RawCard card) {
        return """
                Create example sentences for this flashcard:

                Front (question): %s
                Back (answer): %s
                Deck: %s

                The front is in one language and the back is in another.
                Generate a natural example sentence in the front language that uses the concept,
                and its translation in the back language.
                """.formatted(card.front(), card.back(), card.deckName());
    }
}
