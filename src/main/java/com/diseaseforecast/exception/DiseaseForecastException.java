package com.diseaseforecast.exception;

import lombok.Getter;

@Getter
public abstract class DiseaseForecastException extends RuntimeException {
    private final String errorCode;
    protected DiseaseForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected DiseaseForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
