package com.diseaseforecast.exception;

public class InvalidYearweekException extends DiseaseForecastException {
    public InvalidYearweekException(String yearweek, String reason) {
        super("INVALID_YEARWEEK", "Invalid yearweek '" + yearweek + "': " + reason);
    }
}
