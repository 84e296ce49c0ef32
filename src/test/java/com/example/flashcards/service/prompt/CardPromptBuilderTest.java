package com.example.flashcards.service.prompt;

import com.example.flashcards.model.RawCard;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CardPromptBuilderTest {

    private final CardPromptBuilder builder = new CardPromptBuilder();

    @Test
    void shouldIncludeEveryCardField() {
        String prompt = builder.build(new RawCard("la manzana", "the apple", "Spanish::Food"));

        assertThat(prompt)
                .contains("Front (question): la manzana")
                .contains("Back (answer): the apple")
                .contains("Deck: Spanish::Food");
    }

    @Test
    void shouldKeepInstructionsSeparateFromPrompt() {
        assertThat(builder.instructions()).contains("language learning assistant");
        assertThat(builder.build(new RawCard("a", "b", "c"))).doesNotContain("language learning assistant");
    }
}
