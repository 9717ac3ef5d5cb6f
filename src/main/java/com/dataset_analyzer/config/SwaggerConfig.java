package com.dataset_analyzer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI datasetAnalyzerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Dataset Analyzer API")
                        .version("1.0.0")
                        .description("Routes a tabular dataset to anomaly detection and clustering or to an exploratory audit, then summarises the result as narrative insights.")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local server")
                ));
    }

    @Bean
    public GroupedOpenApi analysisApi() {
        return GroupedOpenApi.builder()
                .group("Analysis APIs")
                .pathsToMatch("/api/**")
                .build();
    }
}
