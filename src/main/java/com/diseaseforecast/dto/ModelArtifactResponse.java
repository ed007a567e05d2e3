package com.diseaseforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class ModelArtifactResponse {
    String code;
    String version;
    LocalDate trainedOn;
    int observationCount;
    int seasonalPeriod;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
}
