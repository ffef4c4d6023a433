package com.epam.aidial.deployer.service;

import com.epam.aidial.deployer.advisor.RemediationAdvisor;
import com.epam.aidial.deployer.data.ActivityEntry;
import com.epam.aidial.deployer.data.ActivityType;
import com.epam.aidial.deployer.data.ArtifactFile;
import com.epam.aidial.deployer.data.ConfigSet;
import com.epam.aidial.deployer.data.CreateDeploymentRequest;
import com.epam.aidial.deployer.data.Deployment;
import com.epam.aidial.deployer.data.DeploymentFilter;
import com.epam.aidial.deployer.data.DeploymentLogs;
import com.epam.aidial.deployer.data.DeploymentPlatform;
import com.epam.aidial.deployer.data.DeploymentStatus;
import com.epam.aidial.deployer.data.FailureType;
import com.epam.aidial.deployer.data.ListResponse;
import com.epam.aidial.deployer.data.ProgressEvent;
import com.epam.aidial.deployer.data.Session;
import com.epam.aidial.deployer.data.SessionStatus;
import com.epam.aidial.deployer.executor.BuildRequest;
import com.epam.aidial.deployer.executor.BuildResult;
import com.epam.aidial.deployer.executor.DeployRequest;
import com.epam.aidial.deployer.executor.DeployResult;
import com.epam.aidial.deployer.executor.DeploymentExecutor;
import com.epam.aidial.deployer.executor.HealthStatus;
import com.epam.aidial.deployer.executor.PreFlightRequest;
import com.epam.aidial.deployer.executor.PreFlightResult;
import com.epam.aidial.deployer.util.CallTimeoutException;
import com.epam.aidial.deployer.util.FutureUtil;
import com.epam.aidial.deployer.util.HttpException;
import com.epam.aidial.deployer.util.HttpStatus;
import com.google.common.annotations.VisibleForTesting;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.Closeable;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Drives deployments through pre-flight, build and deploy, and runs a remediation session after every failed attempt
 * until the deployment is running, fails for good or is cancelled.
 *
 * <p>Each deployment runs on a worker thread and holds an execution token for its whole lifetime.
 * Only the holder of the token transitions the deployment, so the state machine is never raced.
 * Running deployments are then watched by a periodic health check.</p>
 */
@Slf4j
public class DeploymentOrchestrator implements Closeable {

    private static final Pattern ENV_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final String DEFAULT_ENVIRONMENT = "production";
    @VisibleForTesting
    static final String TIMEOUT = "timeout";

    private final Vertx vertx;
    private final DeploymentStore store;
    private final ArtifactStore artifactStore;
    private final DeploymentExecutor executor;
    private final RemediationAdvisor advisor;
    private final ProgressBroadcaster broadcaster;
    private final ExecutionRegistry registry;
    private final LongSupplier clock;
    private final Supplier<String> generator;

    private final WorkerExecutor workers;
    private final Set<DeploymentPlatform> platforms = EnumSet.noneOf(DeploymentPlatform.class);
    private final List<String> requiredFiles;
    private final int defaultMaxAttempts;
    private final int maxAttemptsLimit;
    private final long preFlightTimeout;
    private final long buildTimeout;
    private final long deployTimeout;
    private final long healthTimeout;
    private final RemediationSession.Settings sessionSettings;

    private final Set<String> monitored = ConcurrentHashMap.newKeySet();
    private final long healthTimer;

    public DeploymentOrchestrator(Vertx vertx, DeploymentStore store, ArtifactStore artifactStore,
                                  DeploymentExecutor executor, RemediationAdvisor advisor,
                                  ProgressBroadcaster broadcaster, ExecutionRegistry registry,
                                  JsonObject settings, LongSupplier clock, Supplier<String> generator) {
        this.vertx = vertx;
        this.store = store;
        this.artifactStore = artifactStore;
        this.executor = executor;
        this.advisor = advisor;
        this.broadcaster = broadcaster;
        this.registry = registry;
        this.clock = clock;
        this.generator = generator;

        JsonObject deployments = settings.getJsonObject("deployments", new JsonObject());
        JsonObject executorSettings = settings.getJsonObject("executor", new JsonObject());
        JsonObject artifacts = settings.getJsonObject("artifacts", new JsonObject());

        for (Object platform : deployments.getJsonArray("platforms", new JsonArray().add("docker"))) {
            platforms.add(DeploymentPlatform.valueOf(platform.toString().toUpperCase()));
        }

        this.requiredFiles = artifacts.getJsonArray("requiredFiles", new JsonArray().add("Dockerfile")).stream()
                .map(Object::toString)
                .toList();
        this.defaultMaxAttempts = deployments.getInteger("defaultMaxAttempts", 3);
        this.maxAttemptsLimit = deployments.getInteger("maxAttemptsLimit", 10);
        this.preFlightTimeout = executorSettings.getLong("preFlightTimeout", 30_000L);
        this.buildTimeout = executorSettings.getLong("buildTimeout", 1_800_000L);
        this.deployTimeout = executorSettings.getLong("deployTimeout", 600_000L);
        this.healthTimeout = executorSettings.getLong("healthTimeout", 10_000L);
        this.sessionSettings = RemediationSession.Settings.from(settings.getJsonObject("advisor", new JsonObject()));

        int workerPoolSize = deployments.getInteger("workerPoolSize", 16);
        this.workers = vertx.createSharedWorkerExecutor("deployments", workerPoolSize, Long.MAX_VALUE, TimeUnit.MILLISECONDS);

        long healthCheckPeriod = deployments.getLong("healthCheckPeriod", 30_000L);
        this.healthTimer = (healthCheckPeriod > 0)
                ? vertx.setPeriodic(healthCheckPeriod, ignore -> vertx.executeBlocking(this::checkHealth, false))
                : -1;
    }

    public Deployment create(CreateDeploymentRequest request) {
        if (StringUtils.isBlank(request.getConfigSetId())) {
            throw new IllegalArgumentException("Config set id must be provided");
        }

        int maxAttempts = (request.getMaxAttempts() == null) ? defaultMaxAttempts : request.getMaxAttempts();
        if (maxAttempts < 1 || maxAttempts > maxAttemptsLimit) {
            throw new IllegalArgumentException("Max attempts must be between 1 and " + maxAttemptsLimit);
        }

        String projectId = request.getProjectId();
        if (StringUtils.isBlank(projectId)) {
            ConfigSet configSet = artifactStore.getConfigSet(request.getConfigSetId());
            projectId = (configSet == null) ? null : configSet.getProjectId();
        }

        long now = clock.getAsLong();
        Deployment deployment = new Deployment()
                .setId(generator.get())
                .setConfigSetId(request.getConfigSetId())
                .setProjectId(projectId)
                .setName(request.getName())
                .setPlatform((request.getPlatform() == null) ? DeploymentPlatform.DOCKER : request.getPlatform())
                .setEnvironment(StringUtils.defaultIfBlank(request.getEnvironment(), DEFAULT_ENVIRONMENT))
                .setEnvironmentVariables((request.getEnvironmentVariables() == null) ? Map.of() : request.getEnvironmentVariables())
                .setCustomInstructions(request.getCustomInstructions())
                .setStatus(DeploymentStatus.PENDING)
                .setProgress(DeploymentStatus.PENDING.getProgress())
                .setAttemptNumber(1)
                .setMaxAttempts(maxAttempts)
                .setCreatedAt(now)
                .setUpdatedAt(now)
                .appendActivity(entry(ActivityType.USER_ACTION, "Deployment requested", null, request.getConfigSetId()));

        ExecutionRegistry.Execution execution = registry.acquire(deployment.getId());
        try {
            store.createDeployment(deployment);
        } catch (RuntimeException e) {
            registry.release(execution);
            throw e;
        }

        broadcaster.open(deployment.getId(), deployment);
        log.info("Deployment {} created. Config set: {}. Platform: {}. Max attempts: {}",
                deployment.getId(), deployment.getConfigSetId(), deployment.getPlatform().value(), maxAttempts);

        workers.executeBlocking(() -> {
            run(execution);
            return null;
        }, false).onFailure(error -> log.error("Deployment {} task failed", deployment.getId(), error));

        return deployment;
    }

    public Deployment get(String deploymentId) {
        return store.verifyDeployment(deploymentId);
    }

    public ListResponse<Deployment> list(DeploymentFilter filter) {
        List<Deployment> deployments = store.listDeployments(filter);
        int from = Math.min(Math.max(filter.getOffset(), 0), deployments.size());
        int to = (int) Math.min((long) from + Math.max(filter.getLimit(), 0), deployments.size());
        return new ListResponse<>(List.copyOf(deployments.subList(from, to)), deployments.size());
    }

    public List<Session> listSessions(String deploymentId) {
        store.verifyDeployment(deploymentId);
        return store.listSessions(deploymentId);
    }

    public Session getSession(String deploymentId, String sessionId) {
        return store.verifySession(deploymentId, sessionId);
    }

    /**
     * Requests the cancellation. A running execution observes it at its next boundary,
     * a deployment without execution is cancelled at once.
     *
     * <p>The request is accepted under the record lock, so it either precedes the next transition
     * of the execution or finds the deployment already finished.</p>
     *
     * @throws HttpException with conflict status if the deployment is already finished
     */
    public Deployment cancel(String deploymentId) {
        Deployment deployment = store.verifyDeployment(deploymentId);
        verifyCancellable(deployment);

        ExecutionRegistry.Execution execution = registry.get(deploymentId);
        if (execution == null) {
            Deployment cancelled = finishCancelled(deploymentId, null);
            if (cancelled.getStatus() != DeploymentStatus.CANCELLED) {
                verifyCancellable(cancelled);
            }
            return cancelled;
        }

        boolean[] requested = {false};
        Deployment updated = store.computeDeployment(deploymentId, d -> {
            verifyCancellable(d);
            requested[0] = execution.cancel();
            return requested[0] ? d.appendActivity(entry(ActivityType.USER_ACTION, "Cancellation requested", null, null)) : d;
        });

        if (requested[0]) {
            log.info("Deployment {} cancellation requested", deploymentId);
        }
        return updated;
    }

    private static void verifyCancellable(Deployment deployment) {
        if (deployment.getStatus().isFinished()) {
            throw new HttpException(HttpStatus.CONFLICT,
                    "Deployment %s is already %s".formatted(deployment.getId(), deployment.getStatus().value()));
        }
    }

    /**
     * @throws HttpException with conflict status if the deployment is still in progress
     */
    public void delete(String deploymentId) {
        Deployment deployment = store.verifyDeployment(deploymentId);
        if (!deployment.getStatus().isFinished() || registry.get(deploymentId) != null) {
            throw new HttpException(HttpStatus.CONFLICT,
                    "Deployment %s is %s, cancel it first".formatted(deploymentId, deployment.getStatus().value()));
        }

        monitored.remove(deploymentId);
        if (deployment.getContainerId() != null) {
            teardown(deploymentId, deployment.getContainerId());
        }

        store.deleteDeployment(deploymentId);
    }

    /**
     * @return build logs and the latest runtime logs, fetched from the executor while the container exists
     */
    public DeploymentLogs logs(String deploymentId) {
        Deployment deployment = store.verifyDeployment(deploymentId);
        String runtimeLogs = deployment.getRuntimeLogs();

        if (deployment.getContainerId() != null && executor.isAvailable()) {
            try {
                String fresh = FutureUtil.await(executor.logs(deploymentId, deployment.getContainerId()), healthTimeout, "Logs");
                store.computeDeployment(deploymentId, d -> d.setRuntimeLogs(fresh));
                runtimeLogs = fresh;
            } catch (Exception e) {
                log.warn("Can't fetch runtime logs of deployment {}", deploymentId, e);
            }
        }

        return new DeploymentLogs(deployment.getBuildLogs(), runtimeLogs);
    }

    public ProgressBroadcaster.Snapshot snapshot(String deploymentId) {
        Deployment deployment = store.verifyDeployment(deploymentId);
        DeploymentStatus status = deployment.getStatus();
        return new ProgressBroadcaster.Snapshot(deployment, status.isFinished() ? status.value() : null, deployment.getError());
    }

    public ProgressBroadcaster.Snapshot sessionSnapshot(String deploymentId, String sessionId) {
        Session session = store.verifySession(deploymentId, sessionId);
        SessionStatus status = session.getStatus();
        return new ProgressBroadcaster.Snapshot(session, status.isFinished() ? status.value() : null, session.getError());
    }

    /**
     * Fails deployments interrupted by a restart and resumes health checks of running ones.
     */
    public void recover() {
        List<Deployment> deployments = store.listDeployments(new DeploymentFilter());
        for (Deployment deployment : deployments) {
            String deploymentId = deployment.getId();
            DeploymentStatus status = deployment.getStatus();

            if (!status.isFinished() && registry.get(deploymentId) == null) {
                for (Session session : store.listSessions(deploymentId)) {
                    if (!session.getStatus().isFinished()) {
                        store.saveSession(session.setStatus(SessionStatus.FAILED)
                                .setErrorType(FailureType.EXECUTOR_FAILURE)
                                .setError("Interrupted by service restart")
                                .setCompletedAt(clock.getAsLong()));
                    }
                }
                finishFailed(deploymentId, null, FailureType.EXECUTOR_FAILURE, "Interrupted by service restart");
            } else if ((status == DeploymentStatus.RUNNING || status == DeploymentStatus.DEGRADED) && deployment.getContainerId() != null) {
                monitored.add(deploymentId);
            }
        }
        log.info("Recovered deployments: {}. Monitored: {}", deployments.size(), monitored.size());
    }

    @VisibleForTesting
    void run(ExecutionRegistry.Execution execution) {
        String deploymentId = execution.getDeploymentId();

        try {
            Deployment deployment = transition(execution, DeploymentStatus.PRE_FLIGHT, "Pre-flight started",
                    d -> d.setStartedAt(clock.getAsLong()));
            preFlight(execution, deployment);

            String agentState = null;
            boolean retry = false;

            while (true) {
                boolean next = retry;
                deployment = transition(execution, DeploymentStatus.BUILDING, next ? "Attempt started" : "Build started", d -> {
                    if (next) {
                        d.setAttemptNumber(d.getAttemptNumber() + 1);
                    }
                });

                Failure failure = attempt(execution, deployment);
                if (failure == null) {
                    return;
                }

                recordError(deploymentId, failure.type(), failure.timedOut(), failure.message());
                if (failure.type() == FailureType.RESOURCE_FAULT) {
                    throw new DeploymentFailedException(FailureType.RESOURCE_FAULT, failure.message());
                }

                Session session = remediate(execution, deployment, failure, agentState);
                agentState = session.getAgentState();

                if (session.getErrorType() == FailureType.UNFIXABLE) {
                    throw new DeploymentFailedException(FailureType.UNFIXABLE, session.getError());
                }

                if (deployment.getAttemptNumber() >= deployment.getMaxAttempts()) {
                    FailureType type = (session.getStatus() == SessionStatus.FAILED) ? session.getErrorType() : failure.type();
                    throw new DeploymentFailedException(type, "Attempt budget of %d is exhausted. Last failure: %s"
                            .formatted(deployment.getMaxAttempts(), failure.message()));
                }

                if (session.getStatus() == SessionStatus.FAILED) {
                    recordError(deploymentId, session.getErrorType(), session.getErrorType() == FailureType.ADVISOR_TIMEOUT,
                            "Remediation failed, retrying: " + session.getError());
                }
                retry = true;
            }
        } catch (CancellationException e) {
            finishCancelled(deploymentId, execution);
        } catch (DeploymentFailedException e) {
            finishFailed(deploymentId, execution, e.getType(), e.getMessage());
        } catch (Throwable e) {
            log.error("Deployment {} failed unexpectedly", deploymentId, e);
            finishFailed(deploymentId, execution, FailureType.EXECUTOR_FAILURE, StringUtils.defaultIfBlank(e.getMessage(), e.toString()));
        } finally {
            registry.release(execution);
        }
    }

    private void preFlight(ExecutionRegistry.Execution execution, Deployment deployment) {
        if (!platforms.contains(deployment.getPlatform())) {
            throw new DeploymentFailedException(FailureType.VALIDATION_ERROR,
                    "Platform is not supported: " + deployment.getPlatform().value());
        }

        if (artifactStore.getConfigSet(deployment.getConfigSetId()) == null) {
            throw new DeploymentFailedException(FailureType.VALIDATION_ERROR,
                    "Config set is not found: " + deployment.getConfigSetId());
        }

        List<String> files = artifactStore.read(deployment.getConfigSetId()).stream()
                .map(ArtifactFile::fileName)
                .toList();

        List<String> missing = requiredFiles.stream().filter(file -> !files.contains(file)).toList();
        if (!missing.isEmpty()) {
            throw new DeploymentFailedException(FailureType.VALIDATION_ERROR, "Required files are missing: " + missing);
        }

        for (String name : deployment.getEnvironmentVariables().keySet()) {
            if (!ENV_NAME.matcher(name).matches()) {
                throw new DeploymentFailedException(FailureType.VALIDATION_ERROR, "Invalid environment variable name: " + name);
            }
        }

        if (!executor.isAvailable()) {
            throw new DeploymentFailedException(FailureType.VALIDATION_ERROR, "Deployment executor is not configured");
        }

        PreFlightResult result;
        try {
            result = execution.await(executor.preFlight(new PreFlightRequest(deployment.getId(), deployment.getPlatform(), files)),
                    preFlightTimeout, "Pre-flight");
        } catch (CancellationException e) {
            throw e;
        } catch (Exception e) {
            throw new DeploymentFailedException(FailureType.VALIDATION_ERROR, "Pre-flight check failed: " + e.getMessage());
        }

        if (!result.passed()) {
            throw new DeploymentFailedException(FailureType.VALIDATION_ERROR, "Pre-flight check failed: " + result.describeFailures());
        }

        log.info("Deployment {} passed pre-flight", deployment.getId());
    }

    /**
     * @return the failure of the attempt or null if the deployment is running
     */
    @Nullable
    private Failure attempt(ExecutionRegistry.Execution execution, Deployment deployment) {
        String deploymentId = deployment.getId();
        int attemptNumber = deployment.getAttemptNumber();
        List<ArtifactFile> files = artifactStore.read(deployment.getConfigSetId());

        BuildResult build;
        boolean buildTimedOut = false;
        try {
            build = execution.await(executor.build(new BuildRequest(deploymentId, deployment.getConfigSetId(),
                            deployment.getPlatform(), attemptNumber, files), line -> publishLogs(deploymentId, line, null)),
                    buildTimeout, "Build");
        } catch (CancellationException e) {
            throw e;
        } catch (CallTimeoutException e) {
            build = BuildResult.failure("", e.getMessage());
            buildTimedOut = true;
        } catch (Exception e) {
            build = BuildResult.failure("", describe(e));
        }

        BuildResult built = build;
        store.computeDeployment(deploymentId, d -> d.appendBuildLogs("=== Attempt %d ===\n%s".formatted(attemptNumber, built.logs())));

        if (!built.success()) {
            return new Failure("build", FailureType.EXECUTOR_FAILURE, buildTimedOut, built.logs(), "Build failed: " + built.error());
        }

        transition(execution, DeploymentStatus.DEPLOYING, "Deploy started", d -> { });

        CompletableFuture<DeployResult> future = executor.deploy(new DeployRequest(deploymentId, deployment.getPlatform(),
                built.imageId(), built.imageTag(), deployment.getEnvironment(), deployment.getEnvironmentVariables()),
                line -> publishLogs(deploymentId, null, line));

        DeployResult deploy;
        boolean deployTimedOut = false;
        try {
            deploy = execution.await(future, deployTimeout, "Deploy");
        } catch (CancellationException e) {
            // the container may still come up after the cancellation
            future.thenAccept(result -> {
                if (result != null && result.success() && result.containerId() != null) {
                    workers.executeBlocking(() -> {
                        teardown(deploymentId, result.containerId());
                        return null;
                    }, false);
                }
            });
            throw e;
        } catch (CallTimeoutException e) {
            deploy = DeployResult.failure("", e.getMessage(), false);
            deployTimedOut = true;
        } catch (Exception e) {
            deploy = DeployResult.failure("", describe(e), false);
        }

        if (deploy.success()) {
            running(execution, deploymentId, built, deploy);
            return null;
        }

        DeployResult failed = deploy;
        store.computeDeployment(deploymentId, d -> d.setRuntimeLogs(failed.logs()));

        String logs = failed.logs() + "\n" + StringUtils.defaultString(failed.error());
        if (failed.resourceFault() || ErrorClassifier.classify(logs).kind().isResourceFault()) {
            return new Failure("deploy", FailureType.RESOURCE_FAULT, false, failed.logs(), "Resource fault: " + ErrorClassifier.summarize(logs));
        }

        return new Failure("deploy", FailureType.EXECUTOR_FAILURE, deployTimedOut, failed.logs(), "Deploy failed: " + failed.error());
    }

    private void running(ExecutionRegistry.Execution execution, String deploymentId, BuildResult build, DeployResult deploy) {
        Deployment deployment;
        try {
            deployment = transition(execution, DeploymentStatus.RUNNING, "Deployment is running", d -> d
                    .setContainerId(deploy.containerId())
                    .setImageId(build.imageId())
                    .setImageTag(build.imageTag())
                    .setPorts(deploy.ports())
                    .setDeployUrl(deploy.url())
                    .setRuntimeLogs(deploy.logs())
                    .setCompletedAt(clock.getAsLong()));
        } catch (CancellationException e) {
            teardown(deploymentId, deploy.containerId());
            throw e;
        }

        broadcaster.complete(deploymentId, deployment, ProgressEvent.done(deploymentId, DeploymentStatus.RUNNING.value())
                .setDeployUrl(deployment.getDeployUrl())
                .setAttemptNumber(deployment.getAttemptNumber())
                .setTimestamp(deployment.getCompletedAt()));

        if (deploy.containerId() != null) {
            monitored.add(deploymentId);
        }
    }

    private Session remediate(ExecutionRegistry.Execution execution, Deployment deployment, Failure failure, @Nullable String agentState) {
        Session session = new Session()
                .setId(generator.get())
                .setDeploymentId(deployment.getId())
                .setAttemptNumber(deployment.getAttemptNumber())
                .setStatus(SessionStatus.ACTIVE)
                .setStage(failure.stage())
                .setBuildLogs(failure.logs())
                .setCustomInstructions(deployment.getCustomInstructions())
                .setAgentState(agentState)
                .setStartedAt(clock.getAsLong());

        Deployment updated = store.computeDeployment(deployment.getId(), d -> d.appendActivity(
                entry(ActivityType.STATUS_CHANGE, "Remediation started", null, session.getId())));
        broadcaster.publish(deployment.getId(), updated, ProgressEvent.progress(deployment.getId())
                .setSessionId(session.getId())
                .setAttemptNumber(deployment.getAttemptNumber())
                .setTimestamp(session.getStartedAt()));

        return new RemediationSession(execution, session, deployment.getConfigSetId(), artifactStore, advisor,
                store, broadcaster, sessionSettings, clock, generator).run();
    }

    private Deployment transition(ExecutionRegistry.Execution execution, DeploymentStatus target, String action,
                                  Consumer<Deployment> mutator) {
        execution.checkpoint();
        String deploymentId = execution.getDeploymentId();

        Deployment deployment = store.computeDeployment(deploymentId, d -> {
            if (!d.getStatus().canTransitionTo(target)) {
                throw new IllegalStateException("Invalid transition of deployment %s: %s -> %s"
                        .formatted(deploymentId, d.getStatus().value(), target.value()));
            }

            long now = clock.getAsLong();
            d.setStatus(target).setProgress(target.getProgress()).setUpdatedAt(now);
            mutator.accept(d);
            // a cancellation accepted before the record is written wins over the transition
            execution.checkpoint();
            return d.appendActivity(new ActivityEntry(generator.get(), ActivityType.STATUS_CHANGE, action, null, target.value(), now));
        });

        broadcaster.publish(deploymentId, deployment, ProgressEvent.progress(deploymentId)
                .setStatus(target.value())
                .setProgress(target.getProgress())
                .setAttemptNumber(deployment.getAttemptNumber())
                .setTimestamp(deployment.getUpdatedAt()));

        log.info("Deployment {} is {}. Attempt: {}/{}", deploymentId, target.value(),
                deployment.getAttemptNumber(), deployment.getMaxAttempts());
        return deployment;
    }

    /**
     * @param timedOut whether the failed call exceeded its ceiling, the activity entry is tagged with {@link #TIMEOUT}
     */
    private void recordError(String deploymentId, FailureType type, boolean timedOut, String message) {
        long now = clock.getAsLong();
        Deployment deployment = store.computeDeployment(deploymentId, d -> d.appendActivity(
                new ActivityEntry(generator.get(), ActivityType.ERROR, type.name(), timedOut ? TIMEOUT : null, message, now)));

        broadcaster.publish(deploymentId, deployment, ProgressEvent.error(deploymentId, message)
                .setErrorType(type)
                .setAttemptNumber(deployment.getAttemptNumber())
                .setTimestamp(now));
        log.warn("Deployment {} attempt {} failed. Type: {}. Error: {}", deploymentId, deployment.getAttemptNumber(), type, message);
    }

    private void publishLogs(String deploymentId, @Nullable String buildLogs, @Nullable String runtimeLogs) {
        broadcaster.publish(deploymentId, null, ProgressEvent.progress(deploymentId)
                .setBuildLogs(buildLogs)
                .setRuntimeLogs(runtimeLogs));
    }

    private void finishFailed(String deploymentId, @Nullable ExecutionRegistry.Execution execution, FailureType type, String message) {
        finish(deploymentId, execution, new Outcome(DeploymentStatus.FAILED, type, message));
    }

    private Deployment finishCancelled(String deploymentId, @Nullable ExecutionRegistry.Execution execution) {
        return finish(deploymentId, execution, Outcome.CANCELLED);
    }

    /**
     * Moves the deployment to its final status. An accepted cancellation of the execution overrides any other outcome.
     */
    private Deployment finish(String deploymentId, @Nullable ExecutionRegistry.Execution execution, Outcome requested) {
        Outcome[] applied = {null};
        Deployment deployment = store.computeDeployment(deploymentId, d -> {
            Outcome outcome = (execution != null && execution.isCancelled()) ? Outcome.CANCELLED : requested;
            if (!d.getStatus().canTransitionTo(outcome.status())) {
                return d;
            }

            long now = clock.getAsLong();
            applied[0] = outcome;
            return d.setStatus(outcome.status())
                    .setProgress(outcome.status().getProgress())
                    .setErrorType(outcome.type())
                    .setError(outcome.message())
                    .setCompletedAt(now)
                    .setUpdatedAt(now)
                    .appendActivity(new ActivityEntry(generator.get(), ActivityType.STATUS_CHANGE, outcome.message(), null,
                            outcome.status().value(), now));
        });

        Outcome outcome = applied[0];
        if (outcome == null) {
            log.warn("Deployment {} is already {}, can't move it to {}", deploymentId, deployment.getStatus().value(),
                    requested.status().value());
            return deployment;
        }

        broadcaster.complete(deploymentId, deployment, ProgressEvent.done(deploymentId, outcome.status().value())
                .setErrorType(outcome.type())
                .setError(outcome.message())
                .setAttemptNumber(deployment.getAttemptNumber())
                .setTimestamp(deployment.getCompletedAt()));
        log.warn("Deployment {} is {}. Type: {}. Error: {}", deploymentId, outcome.status().value(), outcome.type(), outcome.message());
        return deployment;
    }

    private void teardown(String deploymentId, String containerId) {
        if (!executor.isAvailable()) {
            log.warn("Can't tear down container {} of deployment {}: executor is not configured", containerId, deploymentId);
            return;
        }

        try {
            FutureUtil.await(executor.teardown(deploymentId, containerId), deployTimeout, "Teardown");
            log.info("Container {} of deployment {} is torn down", containerId, deploymentId);
        } catch (Exception e) {
            log.warn("Can't tear down container {} of deployment {}", containerId, deploymentId, e);
        }
    }

    @VisibleForTesting
    Void checkHealth() {
        for (String deploymentId : monitored) {
            try {
                probe(deploymentId);
            } catch (Throwable e) {
                log.warn("Can't check health of deployment {}", deploymentId, e);
            }
        }
        return null;
    }

    private void probe(String deploymentId) {
        Deployment deployment = store.getDeployment(deploymentId);
        if (deployment == null || deployment.getContainerId() == null
                || (deployment.getStatus() != DeploymentStatus.RUNNING && deployment.getStatus() != DeploymentStatus.DEGRADED)) {
            monitored.remove(deploymentId);
            return;
        }

        HealthStatus health;
        try {
            health = FutureUtil.await(executor.healthCheck(deploymentId, deployment.getContainerId()), healthTimeout, "Health check");
        } catch (Exception e) {
            log.warn("Health check of deployment {} failed: {}", deploymentId, describe(e));
            health = HealthStatus.DEGRADED;
        }

        DeploymentStatus target = (health == HealthStatus.OK) ? DeploymentStatus.RUNNING : DeploymentStatus.DEGRADED;
        if (target == deployment.getStatus()) {
            return;
        }

        String action = (target == DeploymentStatus.DEGRADED) ? "Health check failed" : "Health check recovered";
        Deployment updated = store.computeDeployment(deploymentId, d -> {
            if (!d.getStatus().canTransitionTo(target)) {
                return d;
            }
            long now = clock.getAsLong();
            return d.setStatus(target)
                    .setUpdatedAt(now)
                    .appendActivity(new ActivityEntry(generator.get(), ActivityType.STATUS_CHANGE, action, null, target.value(), now));
        });

        broadcaster.complete(deploymentId, updated, ProgressEvent.done(deploymentId, updated.getStatus().value())
                .setDeployUrl(updated.getDeployUrl())
                .setTimestamp(updated.getUpdatedAt()));
        log.warn("Deployment {} is {}", deploymentId, updated.getStatus().value());
    }

    private ActivityEntry entry(ActivityType type, String action, @Nullable String input, @Nullable String output) {
        return new ActivityEntry(generator.get(), type, action, input, output, clock.getAsLong());
    }

    private static String describe(Throwable error) {
        return StringUtils.defaultIfBlank(error.getMessage(), error.getClass().getSimpleName());
    }

    @Override
    public void close() {
        if (healthTimer >= 0) {
            vertx.cancelTimer(healthTimer);
        }
        workers.close();
    }

    /**
     * @param stage    build or deploy
     * @param timedOut whether the executor call exceeded its ceiling rather than failing
     */
    private record Failure(String stage, FailureType type, boolean timedOut, String logs, String message) {
    }

    private record Outcome(DeploymentStatus status, FailureType type, String message) {
        static final Outcome CANCELLED = new Outcome(DeploymentStatus.CANCELLED, FailureType.CANCELLED_BY_OPERATOR, "Cancelled by operator");
    }

    private static class DeploymentFailedException extends RuntimeException {

        private final FailureType type;

        DeploymentFailedException(FailureType type, String message) {
            super(message);
            this.type = type;
        }

        FailureType getType() {
            return type;
        }
    }
}
