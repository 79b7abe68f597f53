package com.example.footprint.exception;

import lombok.Getter;

@Getter
public class JobNotFoundException extends FootprintException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
}
