package com.diseaseforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class PredictionResponse {
    String predictionId;
    String code;
    String yearweek;
    LocalDate mondayOfWeek;
    double predictedCases;
    double confidenceLower;
    double confidenceUpper;
    String modelVersion;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    boolean actual;
}
