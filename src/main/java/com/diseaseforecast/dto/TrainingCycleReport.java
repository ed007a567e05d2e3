package com.diseaseforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class TrainingCycleReport {
    int forecastSteps;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant completedAt;
    List<CodeOutcome> outcomes;

    public long count(CodeOutcomeStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public long getSucceeded() {
        return count(CodeOutcomeStatus.SUCCEEDED);
    }

    public long getSkipped() {
        return count(CodeOutcomeStatus.SKIPPED);
    }

    public long getFailed() {
        return count(CodeOutcomeStatus.FAILED);
    }
}
