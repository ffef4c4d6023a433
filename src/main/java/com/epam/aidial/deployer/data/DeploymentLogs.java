package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeploymentLogs(String buildLogs, String runtimeLogs) {
}
