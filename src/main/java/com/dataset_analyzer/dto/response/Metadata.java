package com.dataset_analyzer.dto.response;

import lombok.*;

import java.time.Instant;
import java.util.UUID;

@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
public class Metadata {

    @Builder.Default
    private Instant timestamp = Instant.now();

    @Builder.Default
    private String transactionId = UUID.randomUUID().toString();

    public static Metadata forRun(UUID runId) {
        return Metadata.builder().transactionId(runId.toString()).build();
    }
}
