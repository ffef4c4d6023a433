package com.epam.aidial.deployer.service;

import com.epam.aidial.deployer.advisor.AdvisorActivity;
import com.epam.aidial.deployer.advisor.FileEdit;
import com.epam.aidial.deployer.advisor.RemediationAdvisor;
import com.epam.aidial.deployer.advisor.RemediationProposal;
import com.epam.aidial.deployer.advisor.RemediationRequest;
import com.epam.aidial.deployer.data.ActivityEntry;
import com.epam.aidial.deployer.data.ActivityType;
import com.epam.aidial.deployer.data.ArtifactFile;
import com.epam.aidial.deployer.data.ArtifactRevision;
import com.epam.aidial.deployer.data.FailureType;
import com.epam.aidial.deployer.data.FileChange;
import com.epam.aidial.deployer.data.ProgressEvent;
import com.epam.aidial.deployer.data.Session;
import com.epam.aidial.deployer.data.SessionStatus;
import com.epam.aidial.deployer.util.ArtifactConflictException;
import com.epam.aidial.deployer.util.CallTimeoutException;
import com.epam.aidial.deployer.util.JsonUtil;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Runs one remediation attempt: asks the advisor for edits to the failed artifacts and commits them one by one.
 *
 * <p>Each file change is recorded only after its write commits, so replaying the changes of a completed session
 * over the artifacts it started from yields the artifacts it left behind.</p>
 *
 * <p>Advisor activity arrives on the event loop, it only touches the in-memory session and the broadcaster.
 * Everything else runs on the deployment worker.</p>
 */
@Slf4j
class RemediationSession {

    private final Object lock = new Object();
    private final ExecutionRegistry.Execution execution;
    private final Session session;
    private final String configSetId;
    private final ArtifactStore artifactStore;
    private final RemediationAdvisor advisor;
    private final DeploymentStore store;
    private final ProgressBroadcaster broadcaster;
    private final Settings settings;
    private final LongSupplier clock;
    private final Supplier<String> generator;

    RemediationSession(ExecutionRegistry.Execution execution, Session session, String configSetId,
                       ArtifactStore artifactStore, RemediationAdvisor advisor, DeploymentStore store,
                       ProgressBroadcaster broadcaster, Settings settings, LongSupplier clock, Supplier<String> generator) {
        this.execution = execution;
        this.session = session;
        this.configSetId = configSetId;
        this.artifactStore = artifactStore;
        this.advisor = advisor;
        this.store = store;
        this.broadcaster = broadcaster;
        this.settings = settings;
        this.clock = clock;
        this.generator = generator;
    }

    /**
     * @return the finished session
     * @throws CancellationException if the deployment is cancelled, the session is finished as cancelled beforehand
     */
    Session run() {
        String sessionId = session.getId();
        execution.activate(sessionId);

        try {
            Session snapshot = snapshot();
            store.saveSession(snapshot);
            broadcaster.open(sessionId, snapshot);
            log.info("Session {} started. Deployment: {}. Attempt: {}. Stage: {}",
                    sessionId, session.getDeploymentId(), session.getAttemptNumber(), session.getStage());

            execution.checkpoint();
            List<ArtifactFile> files = artifactStore.read(configSetId);
            RemediationProposal proposal = propose(files);

            synchronized (lock) {
                session.setAgentState(proposal.agentState());
            }

            if (proposal.unfixable()) {
                String reason = StringUtils.defaultIfBlank(proposal.rationale(), "no reason given");
                return finish(SessionStatus.FAILED, FailureType.UNFIXABLE, "Failure is unfixable: " + reason);
            }

            record(ActivityType.AI_RESPONSE, "Remediation proposed", null, proposal.rationale());
            apply(files, proposal);
            return finish(SessionStatus.COMPLETED, null, null);
        } catch (CancellationException e) {
            finish(SessionStatus.CANCELLED, FailureType.CANCELLED_BY_OPERATOR, "Cancelled by operator");
            throw e;
        } catch (CallTimeoutException e) {
            return finish(SessionStatus.FAILED, FailureType.ADVISOR_TIMEOUT, e.getMessage());
        } catch (ArtifactConflictException e) {
            return finish(SessionStatus.FAILED, FailureType.ARTIFACT_CONFLICT, e.getMessage());
        } catch (AdvisorException e) {
            return finish(SessionStatus.FAILED, FailureType.ADVISOR_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Session {} failed unexpectedly", sessionId, e);
            finish(SessionStatus.FAILED, FailureType.EXECUTOR_FAILURE, e.getMessage());
            throw e;
        } finally {
            execution.deactivate(sessionId);
        }
    }

    private RemediationProposal propose(List<ArtifactFile> files) {
        if (!advisor.isAvailable()) {
            return RemediationProposal.unfixable("No remediation advisor is configured");
        }

        RemediationRequest request = new RemediationRequest(session.getDeploymentId(), session.getId(),
                session.getAttemptNumber(), session.getStage(), session.getBuildLogs(), files,
                session.getCustomInstructions(), session.getAgentState());

        for (int attempt = 0; ; attempt++) {
            try {
                RemediationProposal proposal = execution.await(advisor.propose(request, this::onActivity),
                        settings.timeout(), "Remediation");
                if (proposal == null || (!proposal.unfixable() && proposal.edits() == null)) {
                    throw new IllegalStateException("Advisor returned no edits");
                }
                if (!proposal.unfixable()) {
                    verifyEdits(proposal.edits());
                }
                return proposal;
            } catch (CancellationException | CallTimeoutException e) {
                throw e;
            } catch (Exception e) {
                String error = StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
                if (attempt >= settings.retries()) {
                    throw new AdvisorException("Advisor failed: " + error, e);
                }

                log.warn("Advisor call of session {} failed, retrying. Attempt: {}. Error: {}", session.getId(), attempt + 1, error);
                record(ActivityType.ERROR, "Advisor call failed", null, error);
                broadcaster.publish(session.getId(), null, ProgressEvent.error(session.getId(), error)
                        .setTimestamp(clock.getAsLong()));
                execution.pause(settings.retryDelay() << attempt);
            }
        }
    }

    /**
     * Rejects the whole proposal before anything is written, so a malformed edit never leaves partial changes.
     */
    private static void verifyEdits(List<FileEdit> edits) {
        for (FileEdit edit : edits) {
            if (edit == null) {
                throw new IllegalStateException("Advisor returned an empty edit");
            }

            try {
                ArtifactStore.verifyFile(edit.file(), edit.content());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Advisor returned an invalid edit: " + e.getMessage(), e);
            }
        }
    }

    private void apply(List<ArtifactFile> files, RemediationProposal proposal) {
        Map<String, ArtifactFile> heads = new HashMap<>();
        for (ArtifactFile file : files) {
            heads.put(file.fileName(), file);
        }

        for (FileEdit edit : proposal.edits()) {
            execution.checkpoint();

            ArtifactFile head = heads.get(edit.file());
            long expectedRevision = (head == null) ? 0 : head.revision();
            ArtifactRevision written = artifactStore.write(configSetId, edit.file(), edit.content(), expectedRevision);
            heads.put(edit.file(), written.toFile());

            String reason = StringUtils.defaultIfBlank(edit.reason(), proposal.rationale());
            FileChange change = new FileChange(edit.file(), (head == null) ? null : head.content(),
                    written.getContent(), reason, clock.getAsLong());

            Session snapshot;
            synchronized (lock) {
                session.appendFileChange(change);
                snapshot = snapshot();
            }

            store.saveSession(snapshot);
            broadcaster.publish(session.getId(), snapshot, ProgressEvent.progress(session.getId())
                    .setFileChanges(List.of(change))
                    .setTimestamp(change.timestamp()));
            log.info("Session {} changed file {}. Revision: {}", session.getId(), edit.file(), written.getRevision());
        }
    }

    private void onActivity(AdvisorActivity activity) {
        ActivityType type = (activity.type() == null) ? ActivityType.TOOL_CALL : activity.type();
        record(type, activity.action(), activity.input(), activity.output());
    }

    private void record(ActivityType type, String action, @Nullable String input, @Nullable String output) {
        ActivityEntry entry = new ActivityEntry(generator.get(), type, action, input, output, clock.getAsLong());
        Session snapshot;

        synchronized (lock) {
            if (session.getStatus().isFinished()) {
                return;
            }
            session.appendActivity(entry);
            snapshot = snapshot();
        }

        broadcaster.publish(session.getId(), snapshot, ProgressEvent.progress(session.getId())
                .setActivityLog(List.of(entry))
                .setTimestamp(entry.timestamp()));
    }

    private Session finish(SessionStatus status, @Nullable FailureType errorType, @Nullable String error) {
        Session snapshot;
        synchronized (lock) {
            session.setStatus(status)
                    .setErrorType(errorType)
                    .setError(error)
                    .setCompletedAt(clock.getAsLong());
            snapshot = snapshot();
        }

        store.saveSession(snapshot);
        broadcaster.complete(session.getId(), snapshot, ProgressEvent.done(session.getId(), status.value())
                .setErrorType(errorType)
                .setError(error)
                .setTimestamp(snapshot.getCompletedAt()));

        if (status == SessionStatus.COMPLETED) {
            log.info("Session {} completed. Changes: {}", session.getId(), snapshot.getFileChanges().size());
        } else {
            log.warn("Session {} is {}. Type: {}. Error: {}", session.getId(), status.value(), errorType, error);
        }
        return snapshot;
    }

    private Session snapshot() {
        synchronized (lock) {
            return JsonUtil.copy(session, Session.class);
        }
    }

    /**
     * @param timeout    of a single advisor call
     * @param retries    of a failed advisor call, timeouts are not retried
     * @param retryDelay before the first retry, doubled for each next one
     */
    record Settings(long timeout, int retries, long retryDelay) {

        static Settings from(JsonObject settings) {
            return new Settings(settings.getLong("timeout", 300_000L),
                    settings.getInteger("retries", 2),
                    settings.getLong("retryDelay", 1_000L));
        }
    }

    private static class AdvisorException extends RuntimeException {
        AdvisorException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
