package com.diseaseforecast.controller;

import com.diseaseforecast.dto.AggregationResult;
import com.diseaseforecast.dto.DailyCaseRequest;
import com.diseaseforecast.dto.DailyCaseResponse;
import com.diseaseforecast.dto.WeeklyCaseResponse;
import com.diseaseforecast.service.CaseIngestionService;
import com.diseaseforecast.service.PipelineOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CaseController {

    private final CaseIngestionService ingestionService;
    private final PipelineOrchestrator orchestrator;

    @PostMapping("/cases")
    public ResponseEntity<DailyCaseResponse> submitDailyCase(@Valid @RequestBody DailyCaseRequest request) {
        log.info("POST /cases | code={} | date={} | cases={}", request.getCode(), request.getDate(), request.getCases());
        DailyCaseResponse response = ingestionService.submitDailyCase(request);
        return ResponseEntity.status(response.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(response);
    }

    @GetMapping("/cases/latest-yearweek")
    public ResponseEntity<Map<String, String>> latestYearweek() {
        return ingestionService.getLatestYearweek()
            .map(yw -> ResponseEntity.ok(Map.of("yearweek", yw)))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/aggregations")
    public ResponseEntity<AggregationResult> aggregate(@RequestParam(required = false) String yearweek) {
        log.info("POST /aggregations | yearweek={}", yearweek);
        return ResponseEntity.ok(orchestrator.runWeeklyAggregation(yearweek));
    }

    @PostMapping("/aggregations/latest")
    public ResponseEntity<AggregationResult> aggregateLatest() {
        log.info("POST /aggregations/latest");
        return ResponseEntity.ok(orchestrator.runLatestWeekAggregation());
    }

    @GetMapping("/weekly-cases")
    public ResponseEntity<List<WeeklyCaseResponse>> weeklyCases(@RequestParam(required = false) String yearweek) {
        return ResponseEntity.ok(ingestionService.getWeeklyStats(yearweek));
    }
}
