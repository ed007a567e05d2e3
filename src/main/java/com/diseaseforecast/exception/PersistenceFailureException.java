package com.diseaseforecast.exception;

public class PersistenceFailureException extends DiseaseForecastException {
    public PersistenceFailureException(String message, Throwable cause) {
        super("PERSISTENCE_FAILED", message, cause);
    }
}
