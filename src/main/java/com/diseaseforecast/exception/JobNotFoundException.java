package com.diseaseforecast.exception;

public class JobNotFoundException extends DiseaseForecastException {
    public JobNotFoundException(String jobName) {
        super("JOB_NOT_FOUND", "Job '" + jobName + "' not found.");
    }
}
