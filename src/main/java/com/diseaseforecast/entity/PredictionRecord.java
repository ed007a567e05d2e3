package com.diseaseforecast.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(
    name = "predictions",
    indexes = {
        @Index(name = "idx_pred_code",          columnList = "icd10_code"),
        @Index(name = "idx_pred_yearweek",      columnList = "yearweek"),
        @Index(name = "idx_pred_model_version", columnList = "model_version"),
        @Index(name = "idx_pred_created",       columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionRecord {

    /** {@code <code>/<yearweek>/<model version>} */
    @Id
    @Column(length = 220, updatable = false, nullable = false)
    private String id;

    @Column(name = "icd10_code", nullable = false, length = 64)
    private String code;

    @Column(nullable = false, length = 6)
    private String yearweek;

    @Column(name = "monday_of_week", nullable = false)
    private LocalDate mondayOfWeek;

    @Column(name = "predicted_cases", nullable = false)
    private double predictedCases;

    @Column(name = "confidence_lower")
    private double confidenceLower;

    @Column(name = "confidence_upper")
    private double confidenceUpper;

    @Column(name = "model_version", nullable = false, length = 128)
    private String modelVersion;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /** {@code false} for a forecast, {@code true} once the realized value is recorded. */
    @Column(name = "is_actual", nullable = false)
    private boolean actual;

    public static String keyOf(String code, String yearweek, String modelVersion) {
        return code + "/" + yearweek + "/" + modelVersion;
    }
}
