package com.example.agentmetrics.error;

public class BrokerUnavailableException extends MetricsException {

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
