package com.diseaseforecast.timeseries;

public record ForecastPoint(double predicted, double lower, double upper) {
}
