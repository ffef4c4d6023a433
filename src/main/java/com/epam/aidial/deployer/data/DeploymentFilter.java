package com.epam.aidial.deployer.data;

import lombok.Data;
import lombok.experimental.Accessors;

@Data
@Accessors(chain = true)
public class DeploymentFilter {
    String projectId;
    String configSetId;
    DeploymentStatus status;
    int limit = 100;
    int offset;

    public boolean matches(Deployment deployment) {
        return (projectId == null || projectId.equals(deployment.getProjectId()))
                && (configSetId == null || configSetId.equals(deployment.getConfigSetId()))
                && (status == null || status == deployment.getStatus());
    }
}
