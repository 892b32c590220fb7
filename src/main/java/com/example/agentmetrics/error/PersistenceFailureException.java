package com.example.agentmetrics.error;

public class PersistenceFailureException extends MetricsException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
