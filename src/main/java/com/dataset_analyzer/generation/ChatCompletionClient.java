package com.dataset_analyzer.generation;

import com.dataset_analyzer.exception.GenerationFailureException;
import com.dataset_analyzer.exception.GenerationTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Calls an OpenAI-compatible chat completion endpoint (Groq, OpenAI, a local gateway).
 * Each call gets its own read timeout on top of a shared JDK {@link HttpClient}.
 */
@Slf4j
public class ChatCompletionClient implements TextGenerationClient {

    static final String SYSTEM_PROMPT = "Data analyst. Be objective.";

    private final RestClient.Builder restClientBuilder;
    private final HttpClient httpClient;
    private final String apiKey;
    private final String model;
    private final double temperature;

    public ChatCompletionClient(RestClient.Builder restClientBuilder, String baseUrl, String apiKey,
                                String model, double temperature, Duration connectTimeout) {
        this.restClientBuilder = restClientBuilder.clone().baseUrl(baseUrl);
        this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
    }

    @Override
    public String generate(String prompt, Duration timeout) {
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        RestClient restClient = restClientBuilder.clone().requestFactory(requestFactory).build();

        Map<String, Object> body = Map.of(
                "model", model,
                "temperature", temperature,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)));

        ChatCompletionResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof HttpTimeoutException) {
                throw new GenerationTimeoutException(timeout, e);
            }
            throw new GenerationFailureException("Text generation service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new GenerationFailureException("Text generation request failed: " + e.getMessage(), e);
        }

        String content = response == null ? null : response.firstContent();
        if (content == null) {
            throw new GenerationFailureException("Text generation returned no content");
        }
        log.debug("Received {} characters from model {}", content.length(), model);
        return content;
    }
}
