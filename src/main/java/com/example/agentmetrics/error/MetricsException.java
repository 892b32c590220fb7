package com.example.agentmetrics.error;

/**
 * Base type for failures inside the metrics pipeline. None of these ever reach the
 * producer of an event; they are logged at the ingestion boundary or inside the workers.
 */
public class MetricsException extends RuntimeException {

    public MetricsException(String message) {
        super(message);
    }

    public MetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
