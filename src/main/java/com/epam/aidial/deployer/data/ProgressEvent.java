package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * Event of a deployment or session progress stream. Fields are present only when they changed.
 * Log and list fields carry the appended part, not the whole accumulated value.
 */
@Data
@Accessors(chain = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgressEvent {
    ProgressEventType type;
    /**
     * Deployment or session id the stream belongs to.
     */
    String id;
    /**
     * Full state of the record, sent with the connected event.
     */
    JsonNode snapshot;
    String status;
    Integer progress;
    Integer attemptNumber;
    String sessionId;
    List<ActivityEntry> activityLog;
    List<FileChange> fileChanges;
    String buildLogs;
    String runtimeLogs;
    String deployUrl;
    FailureType errorType;
    String error;
    Long timestamp;

    public static ProgressEvent connected(String id, JsonNode snapshot) {
        return new ProgressEvent().setType(ProgressEventType.CONNECTED).setId(id).setSnapshot(snapshot);
    }

    public static ProgressEvent progress(String id) {
        return new ProgressEvent().setType(ProgressEventType.PROGRESS).setId(id);
    }

    public static ProgressEvent error(String id, String error) {
        return new ProgressEvent().setType(ProgressEventType.ERROR).setId(id).setError(error);
    }

    public static ProgressEvent done(String id, String status) {
        return new ProgressEvent().setType(ProgressEventType.DONE).setId(id).setStatus(status);
    }

    public static ProgressEvent heartbeat() {
        return new ProgressEvent().setType(ProgressEventType.HEARTBEAT);
    }
}
