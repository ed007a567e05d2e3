package com.diseaseforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyCheckResponse {
    String yearweek;
    int notificationsCreated;
}
