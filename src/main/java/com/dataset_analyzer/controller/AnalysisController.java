package com.dataset_analyzer.controller;

import com.dataset_analyzer.dto.request.AnalyzeRequest;
import com.dataset_analyzer.dto.response.AnalyzeResponse;
import com.dataset_analyzer.dto.response.GenericResponse;
import com.dataset_analyzer.dto.response.Metadata;
import com.dataset_analyzer.service.AnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@CrossOrigin(origins = "*")
@RestController
@RequestMapping("api")
@RequiredArgsConstructor
@Tag(name = "Analysis", description = "Dataset routing, analysis and insight generation")
public class AnalysisController {

    private final AnalysisService analysisService;

    @PostMapping("/analyze")
    @Operation(summary = "Analyze a tabular dataset", description = "Profiles the rows, picks the ML or EDA route and returns the summary with narrative insights")
    public ResponseEntity<GenericResponse<AnalyzeResponse>> analyze(@Valid @RequestBody AnalyzeRequest request) {
        AnalyzeResponse response = analysisService.analyze(request);
        return ResponseEntity.ok(GenericResponse.success("Analysis completed", response, Metadata.forRun(response.getRunId())));
    }
}
