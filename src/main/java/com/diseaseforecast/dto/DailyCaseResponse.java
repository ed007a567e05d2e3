package com.diseaseforecast.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class DailyCaseResponse {
    String id;
    LocalDate date;
    String code;
    int cases;
    String yearweek;
    /** {@code false} when the same code and date had already been submitted. */
    boolean created;
}
