package com.diseaseforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(
    name = "model_artifact",
    uniqueConstraints = @UniqueConstraint(name = "uq_model_artifact", columnNames = {"icd10_code", "version"}),
    indexes = {
        @Index(name = "idx_model_artifact_code_created", columnList = "icd10_code, created_at DESC")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "icd10_code", nullable = false, length = 64)
    private String code;

    @Column(nullable = false, length = 128)
    private String version;

    @Column(name = "trained_on", nullable = false)
    private LocalDate trainedOn;

    @Column(name = "observation_count", nullable = false)
    private int observationCount;

    @Column(name = "seasonal_period", nullable = false)
    private int seasonalPeriod;

    /** Serialized model state, see {@code ModelPayloadCodec}. */
    @Column(nullable = false, columnDefinition = "text")
    private String payload;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
