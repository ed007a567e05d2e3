package com.diseaseforecast.repository;

import java.time.LocalDate;

/** One (code, yearweek) group of daily cases. */
public record WeeklyTotal(String code, String yearweek, Long cases, LocalDate firstDate) {
}
