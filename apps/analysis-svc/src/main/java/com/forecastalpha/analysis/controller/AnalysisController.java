package com.forecastalpha.analysis.controller;

import com.forecastalpha.analysis.analytics.AnalysisService;
import com.forecastalpha.analysis.controller.dto.AnalysisRequestDto;
import com.forecastalpha.analysis.controller.dto.AnalysisResponseDto;
import com.forecastalpha.analysis.controller.dto.DatasetAnalysisRequestDto;
import com.forecastalpha.analysis.model.AnalysisResult;
import jakarta.validation.Valid;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Validated
public class AnalysisController {

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponseDto> analyze(@Valid @RequestBody AnalysisRequestDto request) {
        AnalysisResult result = analysisService.analyzeConnection(
                request.connectionId(),
                request.table(),
                request.toAnalysisRequest()
        );
        return ResponseEntity.ok(map(result));
    }

    @PostMapping("/analyze/dataset")
    public ResponseEntity<AnalysisResponseDto> analyzeDataset(@Valid @RequestBody DatasetAnalysisRequestDto request) {
        AnalysisResult result = analysisService.analyzeDataset(request.rows(), request.toAnalysisRequest());
        return ResponseEntity.ok(map(result));
    }

    private AnalysisResponseDto map(AnalysisResult result) {
        AnalysisResult.Metrics metrics = result.metrics();
        return new AnalysisResponseDto(
                "success",
                result.anomalies().stream()
                        .map(anomaly -> new AnalysisResponseDto.AnomalyDto(
                                anomaly.timestamp(),
                                anomaly.metric(),
                                anomaly.severity().name().toLowerCase(Locale.ROOT),
                                anomaly.value(),
                                anomaly.zScore(),
                                anomaly.score()
                        ))
                        .toList(),
                result.forecast().stream()
                        .map(point -> new AnalysisResponseDto.ForecastPointDto(point.date(), point.prediction()))
                        .toList(),
                result.historical().stream()
                        .map(point -> new AnalysisResponseDto.HistoricalPointDto(point.date(), point.value()))
                        .toList(),
                new AnalysisResponseDto.MetricsDto(
                        metrics.rows(),
                        metrics.anomalies(),
                        metrics.forecastHorizon(),
                        metrics.anomalyMethod().wireName(),
                        metrics.forecastMethod().wireName(),
                        metrics.targetColumn()
                ),
                result.pipelineSteps()
        );
    }
}
