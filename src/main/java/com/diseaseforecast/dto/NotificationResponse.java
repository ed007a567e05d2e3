package com.diseaseforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class NotificationResponse {
    Long id;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    String code;
    String yearweek;
    String message;
}
