package com.epam.aidial.deployer.executor;

import com.epam.aidial.deployer.data.DeploymentPlatform;

import java.util.Map;

public record DeployRequest(String deploymentId,
                            DeploymentPlatform platform,
                            String imageId,
                            String imageTag,
                            String environment,
                            Map<String, String> environmentVariables) {
}
