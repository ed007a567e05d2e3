package com.diseaseforecast.exception;

public class InvalidForecastHorizonException extends DiseaseForecastException {
    public InvalidForecastHorizonException(int steps, int max) {
        super("INVALID_FORECAST_HORIZON",
              "Forecast steps " + steps + " must be between 1 and " + max + ".");
    }
}
