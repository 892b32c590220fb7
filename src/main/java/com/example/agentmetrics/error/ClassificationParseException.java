package com.example.agentmetrics.error;

/**
 * The classification engine answered with something that is not the expected JSON
 * structure. Such results are dropped without retry.
 */
public class ClassificationParseException extends MetricsException {

    public ClassificationParseException(String message) {
        super(message);
    }

    public ClassificationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
