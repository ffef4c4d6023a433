package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    ACTIVE, COMPLETED, FAILED, CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public boolean isFinished() {
        return this != ACTIVE;
    }
}
