package com.diseaseforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    String name;
    String description;
    String cron;
    boolean running;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    ZonedDateTime nextRunTime;
}
