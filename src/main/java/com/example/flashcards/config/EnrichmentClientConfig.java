package com.example.flashcards.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP client for the enrichment endpoint.
 */
@Configuration
@Slf4j
public class EnrichmentClientConfig {

    @Bean
    public RestClient enrichmentRestClient(
            RestClient.Builder builder,
            @Value("${app.enrichment.base-url:http://localhost:8000}") String baseUrl,
            @Value("${app.enrichment.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${app.enrichment.read-timeout-ms:60000}") long readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        log.info("Enrichment client targeting {} (connectTimeout={}ms, readTimeout={}ms)",
                baseUrl, connectTimeoutMs, readTimeoutMs);
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
