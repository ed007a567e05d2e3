package com.diseaseforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(
    name = "notifications",
    uniqueConstraints = @UniqueConstraint(name = "uq_notification_code_week", columnNames = {"icd10_code", "yearweek"}),
    indexes = {
        @Index(name = "idx_notification_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "icd10_code", nullable = false, length = 64)
    private String code;

    @Column(nullable = false, length = 6)
    private String yearweek;

    @Column(nullable = false, length = 1000)
    private String message;
}
