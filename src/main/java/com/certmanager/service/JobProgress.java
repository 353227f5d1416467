package com.certmanager.service;

import lombok.extern.slf4j.Slf4j;

/**
 * Progress of a long running workflow. The percentage never goes backwards, and a failing
 * listener never aborts the workflow it observes.
 */
@Slf4j
public class JobProgress {

    private final String job;
    private final ProgressListener listener;
    private double percent;
    private String message;

    public JobProgress(String job, ProgressListener listener) {
        this.job = job;
        this.listener = listener;
    }

    /**
     * Progress that is only logged.
     */
    public static JobProgress logging(String job) {
        return new JobProgress(job, (percent, message) ->
                log.info("[{}] {}% {}", job, Math.round(percent), message == null ? "" : message));
    }

    public void update(double percent, String message) {
        if (percent > this.percent) {
            this.percent = Math.min(percent, 100);
        }
        if (message != null) {
            this.message = message;
        }
        try {
            listener.onProgress(this.percent, message);
        } catch (RuntimeException e) {
            log.warn("Progress listener of {} failed: {}", job, e.getMessage(), e);
        }
    }

    public void update(double percent) {
        update(percent, null);
    }

    public double getPercent() {
        return percent;
    }

    public String getMessage() {
        return message;
    }
}
