package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.experimental.Accessors;

import java.util.Map;

@Data
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateDeploymentRequest {
    String configSetId;
    String projectId;
    String name;
    DeploymentPlatform platform;
    String environment;
    Map<String, String> environmentVariables;
    Integer maxAttempts;
    String customInstructions;
}
