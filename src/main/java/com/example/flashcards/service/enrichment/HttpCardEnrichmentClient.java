package com.example.flashcards.service.enrichment;

import com.example.flashcards.model.AdditionalFields;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Enrichment over HTTP.
 *
 * Calls {@code POST {app.enrichment.path}} with {@code {model, instructions, prompt}}
 * and expects {@code {example_sentence_front, example_sentence_back}} back. HTTP
 * errors surface as RestClientException and are retried by the executor like any
 * other unit failure.
 */
@Component
@Slf4j
public class HttpCardEnrichmentClient implements CardEnrichmentClient {

    private final RestClient restClient;
    private final EnrichmentResponseValidator validator;
    private final String path;
    private final String model;

    public HttpCardEnrichmentClient(
            @Qualifier("enrichmentRestClient") RestClient restClient,
            EnrichmentResponseValidator validator,
            @Value("${app.enrichment.path:/v1/enrich}") String path,
            @Value("${app.enrichment.model:gpt-5}") String model) {
        this.restClient = restClient;
        this.validator = validator;
        this.path = path;
        this.model = model;
    }

    @Override
    public AdditionalFields enrich(String instructions, String prompt) {
        log.debug("Requesting enrichment from {} (model={})", path, model);
        AdditionalFields reply = restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(new EnrichmentRequest(model, instructions, prompt))
                .retrieve()
                .body(AdditionalFields.class);
        return validator.validate(reply);
    }

    /** Request body for the enrichment endpoint. */
    public record EnrichmentRequest(String model, String instructions, String prompt) {}
}
