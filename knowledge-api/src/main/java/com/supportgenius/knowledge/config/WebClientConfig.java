package com.supportgenius.knowledge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient pineconeWebClient(@Value("${knowledge.pinecone.base-url:http://localhost:5080}") String baseUrl,
                                       @Value("${knowledge.pinecone.api-key:}") String apiKey,
                                       @Value("${knowledge.pinecone.api-version:2024-07}") String apiVersion) {
        WebClient.Builder builder = jsonClient(baseUrl, 0);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("Api-Key", apiKey);
        }
        builder.defaultHeader("X-Pinecone-API-Version", apiVersion);
        return builder.build();
    }

    @Bean
    public WebClient embeddingsWebClient(@Value("${knowledge.openai.base-url:https://api.openai.com}") String baseUrl,
                                         @Value("${knowledge.openai.api-key:}") String apiKey,
                                         @Value("${knowledge.openai.timeout-seconds:60}") long timeoutSeconds) {
        WebClient.Builder builder = jsonClient(baseUrl, timeoutSeconds);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }

    private WebClient.Builder jsonClient(String baseUrl, long timeoutSeconds) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder;
    }

    // upsert batches of 200 x 1536 floats exceed the 256 KB default
    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }
}
