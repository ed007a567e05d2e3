package com.diseaseforecast.controller;

import com.diseaseforecast.dto.AnomalyCheckResponse;
import com.diseaseforecast.dto.ModelArtifactResponse;
import com.diseaseforecast.dto.NotificationResponse;
import com.diseaseforecast.dto.PredictionResponse;
import com.diseaseforecast.dto.TrainingCycleReport;
import com.diseaseforecast.service.AnomalyDetectionService;
import com.diseaseforecast.service.ForecastService;
import com.diseaseforecast.service.ModelStoreService;
import com.diseaseforecast.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final PipelineOrchestrator    orchestrator;
    private final ForecastService         forecastService;
    private final ModelStoreService       modelStoreService;
    private final AnomalyDetectionService anomalyDetectionService;

    @PostMapping("/training-cycles")
    public ResponseEntity<TrainingCycleReport> runTrainingCycle(
            @RequestParam(defaultValue = "${pipeline.forecast.default-steps:4}") int steps) {
        log.info("POST /training-cycles | steps={}", steps);
        return ResponseEntity.ok(orchestrator.runTrainingCycle(steps));
    }

    @PostMapping("/models/{code}/versions/{version}/forecasts")
    public ResponseEntity<List<PredictionResponse>> forecastFromStoredModel(
            @PathVariable String code, @PathVariable String version,
            @RequestParam(defaultValue = "${pipeline.forecast.default-steps:4}") int steps) {
        log.info("POST /models/{}/versions/{}/forecasts | steps={}", code, version, steps);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(orchestrator.forecastFromStoredModel(code, version, steps));
    }

    @GetMapping("/models/{code}/versions")
    public ResponseEntity<List<ModelArtifactResponse>> modelVersions(@PathVariable String code) {
        return ResponseEntity.ok(modelStoreService.listVersions(code));
    }

    @GetMapping("/predictions")
    public ResponseEntity<List<PredictionResponse>> predictions(
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String version) {
        return ResponseEntity.ok(forecastService.getPredictions(code, version));
    }

    @PostMapping("/anomaly-checks")
    public ResponseEntity<AnomalyCheckResponse> checkAnomalies(@RequestParam(required = false) String yearweek) {
        log.info("POST /anomaly-checks | yearweek={}", yearweek);
        return ResponseEntity.ok(orchestrator.checkAnomalies(yearweek));
    }

    @GetMapping("/notifications")
    public ResponseEntity<List<NotificationResponse>> notifications(@RequestParam(required = false) String code) {
        return ResponseEntity.ok(anomalyDetectionService.listNotifications(code));
    }
}
