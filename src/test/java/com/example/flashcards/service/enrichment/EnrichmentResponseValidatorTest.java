package com.example.flashcards.service.enrichment;

import com.example.flashcards.model.AdditionalFields;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnrichmentResponseValidatorTest {

    private final EnrichmentResponseValidator validator = new EnrichmentResponseValidator();

    @Test
    void shouldStripValidSentences() {
        AdditionalFields fields = validator.validate(new AdditionalFields("  Tengo un perro. ", "I have a dog.\n"));

        assertThat(fields).isEqualTo(new AdditionalFields("Tengo un perro.", "I have a dog."));
    }

    @Test
    void shouldRejectMissingOrBlankFields() {
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOf(InvalidEnrichmentException.class);
        assertThatThrownBy(() -> validator.validate(new AdditionalFields(null, "I have a dog.")))
                .isInstanceOf(InvalidEnrichmentException.class)
                .hasMessageContaining("example_sentence_front");
        assertThatThrownBy(() -> validator.validate(new AdditionalFields("Tengo un perro.", "   ")))
                .isInstanceOf(InvalidEnrichmentException.class)
                .hasMessageContaining("example_sentence_back");
    }
}
