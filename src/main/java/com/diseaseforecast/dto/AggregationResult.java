package com.diseaseforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AggregationResult {
    AggregationMode mode;
    /** Week that was recomputed; absent for backfill runs. */
    String yearweek;
    int weeksWritten;

    public enum AggregationMode { TARGET_WEEK, BACKFILL, LATEST_WEEK }
}
