package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityType {
    TOOL_CALL, AI_RESPONSE, USER_ACTION, STATUS_CHANGE, ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
