package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressEventType {
    CONNECTED, PROGRESS, ERROR, DONE, HEARTBEAT;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
