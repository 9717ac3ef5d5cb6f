package com.dataset_analyzer.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Map;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalyzeRequest {

    @NotBlank(message = "You must provide a dataset name")
    @Size(max = 255, message = "Dataset name must be at most 255 characters")
    private String datasetName;

    @PositiveOrZero(message = "Row count hint cannot be negative")
    private Integer rowCountHint;

    @NotNull(message = "Rows must be provided")
    private List<Map<String, Object>> rows;

    // Passed through by the transport layer, never read by the analysis
    private String requesterIdentity;
}
