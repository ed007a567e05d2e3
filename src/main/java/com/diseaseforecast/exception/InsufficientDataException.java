package com.diseaseforecast.exception;

public class InsufficientDataException extends DiseaseForecastException {
    public InsufficientDataException(String code) {
        super("INSUFFICIENT_DATA", "No weekly cases found for ICD10 code '" + code + "'.");
    }
}
