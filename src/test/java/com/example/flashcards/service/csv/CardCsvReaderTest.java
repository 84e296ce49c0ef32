package com.example.flashcards.service.csv;

import com.example.flashcards.model.RawCard;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardCsvReaderTest {

    @TempDir
    Path tempDir;

    private final CardCsvReader reader = new CardCsvReader();

    private Path deck(String content) throws IOException {
        Path file = tempDir.resolve("deck.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Should read cards in file order regardless of column order")
    void shouldReadCardsInOrder() throws IOException {
        // Given
        Path file = deck("""
                deck_name,Back,Front,Notes
                Spanish,dog,perro,noun
                Spanish,"to eat, to have lunch",comer,verb
                """);

        // When
        List<RawCard> cards = reader.read(file);

        // Then
        assertThat(cards).containsExactly(
                new RawCard("perro", "dog", "Spanish"),
                new RawCard("comer", "to eat, to have lunch", "Spanish"));
    }

    @Test
    @DisplayName("Should stop after the limit")
    void shouldApplyLimit() throws IOException {
        Path file = deck("Front,Back,deck_name\na,1,d\nb,2,d\nc,3,d\n");

        assertThat(reader.read(file, 2)).extracting(RawCard::front).containsExactly("a", "b");
        assertThat(reader.read(file, 0)).hasSize(3);
    }

    @Test
    @DisplayName("Should accept a header starting with a byte order mark")
    void shouldStripByteOrderMark() throws IOException {
        Path file = deck("\uFEFFFront,Back,deck_name\nhola,hello,Basics\n");

        assertThat(reader.read(file)).containsExactly(new RawCard("hola", "hello", "Basics"));
    }

    @Test
    @DisplayName("Should skip rows that are too short")
    void shouldSkipShortRows() throws IOException {
        Path file = deck("Front,Back,deck_name\nhola,hello,Basics\nbroken\nadios,bye,Basics\n");

        assertThat(reader.read(file)).extracting(RawCard::front).containsExactly("hola", "adios");
    }

    @Test
    @DisplayName("Should fail when a required column is missing")
    void shouldRejectMissingColumn() throws IOException {
        Path file = deck("Front,Back\nhola,hello\n");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(CardCsvException.class)
                .hasMessageContaining("deck_name");
    }

    @Test
    @DisplayName("Should return no cards for an empty file and reject a missing one")
    void shouldHandleEmptyAndMissingFiles() throws IOException {
        assertThat(reader.read(deck(""))).isEmpty();

        assertThatThrownBy(() -> reader.read(tempDir.resolve("nope.csv")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("File not found");
    }
}
