package com.dataset_analyzer.config;

import com.dataset_analyzer.generation.ChatCompletionClient;
import com.dataset_analyzer.generation.TextGenerationClient;
import com.dataset_analyzer.generation.UnavailableTextGenerationClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Wires the text-generation client and the pool its blocking calls run on.
 * Set {@code GENERATION_API_KEY} to enable generated insights; without it every report uses templates.
 */
@Slf4j
@Configuration
public class GenerationClientConfig {

    @Value("${generation.base-url}")
    private String baseUrl;

    @Value("${generation.api-key:}")
    private String apiKey;

    @Value("${generation.model}")
    private String model;

    @Value("${generation.temperature:0.7}")
    private double temperature;

    @Value("${generation.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${generation.pool.core-size:4}")
    private int corePoolSize;

    @Value("${generation.pool.max-size:16}")
    private int maxPoolSize;

    @Value("${generation.pool.queue-capacity:100}")
    private int queueCapacity;

    @Bean
    public TextGenerationClient textGenerationClient(RestClient.Builder restClientBuilder) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No generation API key configured; insights will use the template fallback");
            return new UnavailableTextGenerationClient("no API key configured");
        }
        log.info("Text generation via {} using model {}", baseUrl, model);
        return new ChatCompletionClient(restClientBuilder, baseUrl, apiKey, model, temperature, connectTimeout);
    }

    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("generation-");
        executor.initialize();
        return executor;
    }
}
