package com.diseaseforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.LocalDate;

@Entity
@Table(
    name = "daily_case",
    indexes = {
        @Index(name = "idx_daily_yearweek", columnList = "yearweek"),
        @Index(name = "idx_daily_code",     columnList = "icd10_code"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyCase implements Persistable<String> {

    /** {@code <code>.<ISO date>} */
    @Id
    @Column(length = 80, updatable = false, nullable = false)
    private String id;

    @Column(name = "case_date", nullable = false)
    private LocalDate caseDate;

    @Column(nullable = false)
    private int cases;

    @Column(name = "icd10_code", nullable = false, length = 64)
    private String code;

    @Column(nullable = false, length = 6)
    private String yearweek;

    /** Submissions are inserts only; a duplicate key must fail rather than merge. */
    @Transient
    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean fresh = true;

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        fresh = false;
    }

    public static String keyOf(String code, LocalDate date) {
        return code + "." + date;
    }
}
