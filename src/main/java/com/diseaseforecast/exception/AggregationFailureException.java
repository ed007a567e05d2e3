package com.diseaseforecast.exception;

public class AggregationFailureException extends DiseaseForecastException {
    public AggregationFailureException(String target, Throwable cause) {
        super("AGGREGATION_FAILED", "Weekly aggregation failed for " + target + ": " + cause.getMessage(), cause);
    }
}
