package com.diseaseforecast.controller;

import com.diseaseforecast.dto.JobStatusResponse;
import com.diseaseforecast.service.PipelineJobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final PipelineJobScheduler scheduler;

    @GetMapping
    public ResponseEntity<List<JobStatusResponse>> jobs() {
        return ResponseEntity.ok(scheduler.status());
    }

    @GetMapping("/{name}")
    public ResponseEntity<JobStatusResponse> job(@PathVariable String name) {
        return ResponseEntity.ok(scheduler.status(name));
    }

    @PostMapping("/{name}/start")
    public ResponseEntity<JobStatusResponse> start(@PathVariable String name) {
        log.info("POST /jobs/{}/start", name);
        return ResponseEntity.ok(scheduler.start(name));
    }

    @PostMapping("/{name}/stop")
    public ResponseEntity<JobStatusResponse> stop(@PathVariable String name) {
        log.info("POST /jobs/{}/stop", name);
        return ResponseEntity.ok(scheduler.stop(name));
    }

    @PostMapping("/{name}/run")
    public ResponseEntity<JobStatusResponse> run(@PathVariable String name) {
        log.info("POST /jobs/{}/run", name);
        return ResponseEntity.ok(scheduler.runNow(name));
    }
}
