package com.diseaseforecast.exception;

public class PipelineBusyException extends DiseaseForecastException {
    public PipelineBusyException(String lockKey) {
        super("PIPELINE_BUSY",
              "Another pipeline run holds '" + lockKey + "'. Please try again later.");
    }
}
