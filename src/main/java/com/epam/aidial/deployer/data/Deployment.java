package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Durable record of one rollout of a config set.
 */
@Data
@Accessors(chain = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Deployment {
    String id;
    String configSetId;
    String projectId;
    String name;
    DeploymentPlatform platform;
    /**
     * Free-form environment label, for example: production, staging.
     */
    String environment;
    Map<String, String> environmentVariables;
    /**
     * Operator hint handed to every remediation session.
     */
    String customInstructions;

    DeploymentStatus status;
    Integer progress;
    int attemptNumber;
    int maxAttempts;

    /**
     * Runtime descriptor. Populated only once the deployment is running.
     */
    String containerId;
    String imageId;
    String imageTag;
    List<PortMapping> ports;
    String deployUrl;

    String buildLogs;
    String runtimeLogs;

    FailureType errorType;
    String error;

    List<ActivityEntry> activityLog = List.of();

    Long createdAt;
    Long startedAt;
    Long completedAt;
    Long updatedAt;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public Long getDuration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return completedAt - startedAt;
    }

    public Deployment appendActivity(ActivityEntry entry) {
        List<ActivityEntry> entries = new ArrayList<>(activityLog);
        entries.add(entry);
        activityLog = Collections.unmodifiableList(entries);
        return this;
    }

    public Deployment appendBuildLogs(String logs) {
        buildLogs = (buildLogs == null) ? logs : buildLogs + logs;
        return this;
    }
}
