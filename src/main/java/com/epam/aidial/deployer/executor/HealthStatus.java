package com.epam.aidial.deployer.executor;

public enum HealthStatus {
    OK, DEGRADED
}
