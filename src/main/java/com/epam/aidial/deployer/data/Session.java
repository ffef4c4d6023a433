package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One remediation attempt within a deployment.
 * The activity log and the file changes are append-only: every append replaces the list with a new immutable copy.
 */
@Data
@Accessors(chain = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Session {
    String id;
    String deploymentId;
    int attemptNumber;
    SessionStatus status;
    /**
     * Build or deploy stage the remediated failure comes from.
     */
    String stage;
    String customInstructions;
    /**
     * Opaque advisor progress marker, never inspected.
     */
    String agentState;
    List<FileChange> fileChanges = List.of();
    List<ActivityEntry> activityLog = List.of();
    String buildLogs;
    FailureType errorType;
    String error;
    Long startedAt;
    Long completedAt;

    public Session appendFileChange(FileChange change) {
        fileChanges = append(fileChanges, change);
        return this;
    }

    public Session appendActivity(ActivityEntry entry) {
        activityLog = append(activityLog, entry);
        return this;
    }

    private static <T> List<T> append(List<T> list, T item) {
        List<T> copy = new ArrayList<>(list.size() + 1);
        copy.addAll(list);
        copy.add(item);
        return Collections.unmodifiableList(copy);
    }
}
