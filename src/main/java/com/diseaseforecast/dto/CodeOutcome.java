package com.diseaseforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CodeOutcome {
    String code;
    CodeOutcomeStatus status;
    String modelVersion;
    Integer observations;
    Integer predictionsWritten;
    String message;
}
