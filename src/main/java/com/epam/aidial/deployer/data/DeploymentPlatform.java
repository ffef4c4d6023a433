package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Deployment targets. Only the ones listed in {@code deployments.platforms} are accepted by pre-flight.
 */
public enum DeploymentPlatform {
    DOCKER, KUBERNETES, CLOUD_RUN, ECS;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
