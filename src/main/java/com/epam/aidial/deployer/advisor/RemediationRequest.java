package com.epam.aidial.deployer.advisor;

import com.epam.aidial.deployer.data.ArtifactFile;

import java.util.List;
import javax.annotation.Nullable;

/**
 * @param stage      build or deploy
 * @param hint       optional operator instructions
 * @param agentState token issued by the previous advisor call of the deployment, passed back as is
 */
public record RemediationRequest(String deploymentId,
                                 String sessionId,
                                 int attemptNumber,
                                 String stage,
                                 String logs,
                                 List<ArtifactFile> files,
                                 @Nullable String hint,
                                 @Nullable String agentState) {
}
