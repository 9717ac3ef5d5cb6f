package com.dataset_analyzer.service;

import com.dataset_analyzer.config.AnalysisConfig;
import com.dataset_analyzer.dto.request.AnalyzeRequest;
import com.dataset_analyzer.dto.response.AnalyzeResponse;
import com.dataset_analyzer.model.analysis.AnalysisRun;
import com.dataset_analyzer.service.orchestrator.AnalysisOrchestrator;
import com.dataset_analyzer.service.orchestrator.CancellationCheck;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.UUID;

/**
 * Entry point of the analysis core for the transport layer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private final DatasetAssembler datasetAssembler;
    private final AnalysisOrchestrator orchestrator;
    private final AnalysisConfig analysisConfig;

    public AnalyzeResponse analyze(AnalyzeRequest request) {
        return AnalyzeResponse.from(run(request, CancellationCheck.currentThread()));
    }

    public AnalysisRun run(AnalyzeRequest request, CancellationCheck cancellation) {
        UUID runId = UUID.randomUUID();
        log.info("📥 Analysis request {} for '{}' ({} rows)", runId, request.getDatasetName(),
                request.getRows() == null ? 0 : request.getRows().size());

        DatasetAssembler.AssembledDataset assembled = datasetAssembler.assemble(
                request.getDatasetName(), request.getRows(), analysisConfig.schemaPolicy());

        Integer hint = request.getRowCountHint();
        int actualRows = request.getRows() == null ? 0 : request.getRows().size();
        if (hint != null && !Objects.equals(hint, actualRows)) {
            log.warn("Run {}: row count hint {} differs from the {} rows received", runId, hint, actualRows);
        }

        return orchestrator.analyze(runId, assembled.dataset(), analysisConfig, cancellation, assembled.droppedRows());
    }
}
