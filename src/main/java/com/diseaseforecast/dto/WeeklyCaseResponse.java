package com.diseaseforecast.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class WeeklyCaseResponse {
    String yearweek;
    String code;
    long cases;
    LocalDate mondayOfWeek;
}
