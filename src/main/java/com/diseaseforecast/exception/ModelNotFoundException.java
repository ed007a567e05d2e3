package com.diseaseforecast.exception;

public class ModelNotFoundException extends DiseaseForecastException {
    public ModelNotFoundException(String code, String version) {
        super("MODEL_NOT_FOUND", "Model version '" + version + "' for ICD10 code '" + code + "' not found.");
    }
}
