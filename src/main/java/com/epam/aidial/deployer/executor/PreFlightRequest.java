package com.epam.aidial.deployer.executor;

import com.epam.aidial.deployer.data.DeploymentPlatform;

import java.util.List;

public record PreFlightRequest(String deploymentId, DeploymentPlatform platform, List<String> files) {
}
