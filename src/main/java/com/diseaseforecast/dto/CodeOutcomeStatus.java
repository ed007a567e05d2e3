package com.diseaseforecast.dto;

public enum CodeOutcomeStatus {
    SUCCEEDED,
    SKIPPED,
    FAILED
}
