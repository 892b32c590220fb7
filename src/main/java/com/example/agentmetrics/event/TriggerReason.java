package com.example.agentmetrics.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TriggerReason {
    MANUAL_CLOSE("manual_close", false),
    AUTO_CLOSE("auto_close", true),
    FRONTEND_CLOSE("frontend_close", true),
    INACTIVITY_TIMEOUT("inactivity_timeout", true);

    private final String value;
    private final boolean automatic;

    TriggerReason(String value, boolean automatic) {
        this.value = value;
        this.automatic = automatic;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Automatic triggers only fire for conversations with the configured minimum of messages.
     */
    public boolean isAutomatic() {
        return automatic;
    }

    @JsonCreator
    public static TriggerReason fromValue(String value) {
        for (TriggerReason reason : values()) {
            if (reason.value.equals(value)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown trigger reason: " + value);
    }
}
