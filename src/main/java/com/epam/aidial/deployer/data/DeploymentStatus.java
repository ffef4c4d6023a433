package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Set;

@Getter
@RequiredArgsConstructor
public enum DeploymentStatus {
    PENDING(0),
    PRE_FLIGHT(10),
    BUILDING(30),
    DEPLOYING(70),
    RUNNING(100),
    DEGRADED(100),
    FAILED(100),
    CANCELLED(100);

    /**
     * Rough completion percentage reported to progress subscribers.
     */
    private final int progress;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    /**
     * @return true once the orchestrator is done with the deployment. Only health observations follow.
     */
    public boolean isFinished() {
        return this == RUNNING || this == DEGRADED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(DeploymentStatus target) {
        return next().contains(target);
    }

    private Set<DeploymentStatus> next() {
        return switch (this) {
            case PENDING -> Set.of(PRE_FLIGHT, FAILED, CANCELLED);
            case PRE_FLIGHT -> Set.of(BUILDING, FAILED, CANCELLED);
            // building re-enters itself on the retry edge
            case BUILDING, DEPLOYING -> Set.of(BUILDING, DEPLOYING, RUNNING, FAILED, CANCELLED);
            case RUNNING -> Set.of(DEGRADED);
            case DEGRADED -> Set.of(RUNNING);
            case FAILED, CANCELLED -> Set.of();
        };
    }

    public static DeploymentStatus fromValue(String value) {
        for (DeploymentStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown deployment status: " + value);
    }
}
