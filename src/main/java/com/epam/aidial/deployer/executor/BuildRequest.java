package com.epam.aidial.deployer.executor;

import com.epam.aidial.deployer.data.ArtifactFile;
import com.epam.aidial.deployer.data.DeploymentPlatform;

import java.util.List;

public record BuildRequest(String deploymentId,
                           String configSetId,
                           DeploymentPlatform platform,
                           int attemptNumber,
                           List<ArtifactFile> files) {
}
