package com.example.agentmetrics.service;

public record CloseOutcome(Status status, String sessionId, int messageCount) {

    public enum Status {
        REQUESTED,
        NO_MESSAGES,
        INSUFFICIENT_MESSAGES,
        ALREADY_CLASSIFIED,
        FAILED
    }

    public boolean requested() {
        return status == Status.REQUESTED;
    }
}
