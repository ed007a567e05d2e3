package com.diseaseforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.*;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class DailyCaseRequest {

    @NotNull(message = "date is required")
    @PastOrPresent(message = "date must not be in the future")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;

    @NotBlank(message = "code is required")
    @Size(max = 64, message = "code must be at most 64 characters")
    String code;

    @NotNull(message = "cases is required")
    @Min(value = 0, message = "cases must be >= 0")
    Integer cases;
}
