package com.example.agentmetrics.error;

import com.example.agentmetrics.event.EventCategory;

public class EnqueueFailureException extends MetricsException {

    private final EventCategory category;

    public EnqueueFailureException(EventCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public EventCategory getCategory() {
        return category;
    }
}
