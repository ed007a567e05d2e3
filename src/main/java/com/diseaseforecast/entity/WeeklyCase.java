package com.diseaseforecast.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(
    name = "weekly_case",
    indexes = {
        @Index(name = "idx_weekly_yearweek", columnList = "yearweek"),
        @Index(name = "idx_weekly_code",     columnList = "icd10_code"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WeeklyCase {

    /** {@code <code>.<yearweek>} */
    @Id
    @Column(length = 80, updatable = false, nullable = false)
    private String id;

    @Column(nullable = false, length = 6)
    private String yearweek;

    @Column(nullable = false)
    private long cases;

    @Column(name = "monday_of_week", nullable = false)
    private LocalDate mondayOfWeek;

    @Column(name = "icd10_code", nullable = false, length = 64)
    private String code;

    public static String keyOf(String code, String yearweek) {
        return code + "." + yearweek;
    }
}
