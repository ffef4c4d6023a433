package com.epam.aidial.deployer.service;

import com.epam.aidial.deployer.TestStorage;
import com.epam.aidial.deployer.advisor.AdvisorActivity;
import com.epam.aidial.deployer.advisor.FileEdit;
import com.epam.aidial.deployer.advisor.RemediationAdvisor;
import com.epam.aidial.deployer.advisor.RemediationProposal;
import com.epam.aidial.deployer.advisor.RemediationRequest;
import com.epam.aidial.deployer.data.ActivityEntry;
import com.epam.aidial.deployer.data.ActivityType;
import com.epam.aidial.deployer.data.ArtifactFile;
import com.epam.aidial.deployer.data.ConfigSet;
import com.epam.aidial.deployer.data.CreateDeploymentRequest;
import com.epam.aidial.deployer.data.Deployment;
import com.epam.aidial.deployer.data.DeploymentFilter;
import com.epam.aidial.deployer.data.DeploymentPlatform;
import com.epam.aidial.deployer.data.DeploymentStatus;
import com.epam.aidial.deployer.data.FailureType;
import com.epam.aidial.deployer.data.FileChange;
import com.epam.aidial.deployer.data.ListResponse;
import com.epam.aidial.deployer.data.PortMapping;
import com.epam.aidial.deployer.data.ProgressEvent;
import com.epam.aidial.deployer.data.ProgressEventType;
import com.epam.aidial.deployer.data.Session;
import com.epam.aidial.deployer.data.SessionStatus;
import com.epam.aidial.deployer.executor.BuildResult;
import com.epam.aidial.deployer.executor.DeployRequest;
import com.epam.aidial.deployer.executor.DeployResult;
import com.epam.aidial.deployer.executor.DeploymentExecutor;
import com.epam.aidial.deployer.executor.HealthStatus;
import com.epam.aidial.deployer.executor.PreFlightResult;
import com.epam.aidial.deployer.storage.BlobStorage;
import com.epam.aidial.deployer.util.HttpException;
import com.epam.aidial.deployer.util.HttpStatus;
import com.epam.aidial.deployer.util.ResourceNotFoundException;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DeploymentOrchestratorTest {

    private static final String DOCKERFILE = "FROM node:18\nCMD [\"npm\", \"start\"]\n";
    private static final String FIXED_DOCKERFILE = "FROM node:20\nCMD [\"npm\", \"start\"]\n";

    private Vertx vertx;
    private BlobStorage storage;
    private ArtifactStore artifactStore;
    private DeploymentStore store;
    private ExecutionRegistry registry;
    private ProgressBroadcaster broadcaster;
    private DeploymentExecutor executor;
    private RemediationAdvisor advisor;
    private DeploymentOrchestrator orchestrator;

    @BeforeEach
    void init() {
        vertx = Vertx.vertx();
        storage = TestStorage.transientStorage();

        LockService lockService = new LockService();
        artifactStore = new ArtifactStore(storage, lockService, new JsonObject(), System::currentTimeMillis);
        store = new DeploymentStore(storage, lockService);
        registry = new ExecutionRegistry();
        broadcaster = new ProgressBroadcaster(Mockito.mock(HeartbeatService.class), new JsonObject());

        executor = Mockito.mock(DeploymentExecutor.class);
        when(executor.isAvailable()).thenReturn(true);
        when(executor.preFlight(any())).thenAnswer(invocation ->
                CompletableFuture.completedFuture(new PreFlightResult(true, List.of())));
        when(executor.deploy(any(), any())).thenAnswer(invocation -> CompletableFuture.completedFuture(
                DeployResult.success("listening on 3000", "c1", List.of(new PortMapping(32768, 3000, "tcp")), "http://localhost:32768")));
        when(executor.teardown(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));

        advisor = Mockito.mock(RemediationAdvisor.class);
        when(advisor.isAvailable()).thenReturn(true);

        orchestrator = orchestrator(settings(), System::currentTimeMillis);

        artifactStore.register(new ConfigSet().setId("cs1").setProjectId("p1").setName("web"));
        artifactStore.write("cs1", "Dockerfile", DOCKERFILE, 0L);
    }

    @AfterEach
    void destroy() {
        orchestrator.close();
        vertx.close().toCompletionStage().toCompletableFuture().join();
        storage.close();
    }

    @Test
    void testDeploymentRunsAtFirstAttempt() throws Exception {
        buildSucceeds();

        Deployment created = orchestrator.create(request());
        assertEquals(DeploymentStatus.PENDING, created.getStatus());
        assertEquals("p1", created.getProjectId());
        assertEquals("production", created.getEnvironment());

        Deployment deployment = awaitFinished(created.getId());
        assertEquals(DeploymentStatus.RUNNING, deployment.getStatus());
        assertEquals(100, deployment.getProgress());
        assertEquals(1, deployment.getAttemptNumber());
        assertEquals("c1", deployment.getContainerId());
        assertEquals("img1", deployment.getImageId());
        assertEquals("http://localhost:32768", deployment.getDeployUrl());
        assertTrue(deployment.getBuildLogs().startsWith("=== Attempt 1 ===\n"));
        assertTrue(deployment.getDuration() >= 0);
        assertTrue(orchestrator.listSessions(created.getId()).isEmpty());
        verify(advisor, never()).propose(any(), any());

        List<String> statuses = deployment.getActivityLog().stream()
                .filter(entry -> entry.type() == ActivityType.STATUS_CHANGE)
                .map(entry -> entry.output())
                .toList();
        assertEquals(List.of("pre_flight", "building", "deploying", "running"), statuses);

        List<ProgressEvent> events = new ArrayList<>();
        broadcaster.subscribe(created.getId(), () -> fail("Topic must be known"), events::add);
        assertEquals(List.of(ProgressEventType.CONNECTED, ProgressEventType.DONE), events.stream().map(ProgressEvent::getType).toList());
        assertEquals("running", events.get(1).getStatus());
    }

    @Test
    void testDeploymentRecoversAfterRemediation() throws Exception {
        when(executor.build(any(), any()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(
                        BuildResult.failure("npm ERR! engine node@18 is not supported", "exit code 1")))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(
                        BuildResult.success("built", "img2", "web:2")));

        when(advisor.propose(any(), any())).thenAnswer(invocation -> {
            Consumer<AdvisorActivity> listener = invocation.getArgument(1);
            listener.accept(new AdvisorActivity(ActivityType.TOOL_CALL, "read_file", "Dockerfile", DOCKERFILE));
            return CompletableFuture.completedFuture(RemediationProposal.edits(List.of(
                    new FileEdit("Dockerfile", FIXED_DOCKERFILE, "Upgrade node"),
                    new FileEdit("entrypoint.sh", "#!/bin/sh\nnpm start\n", null)), "Node 18 is too old", "state-1"));
        });

        Deployment created = orchestrator.create(request().setCustomInstructions("Keep alpine images"));
        Deployment deployment = awaitFinished(created.getId());

        assertEquals(DeploymentStatus.RUNNING, deployment.getStatus());
        assertEquals(2, deployment.getAttemptNumber());
        assertTrue(deployment.getBuildLogs().contains("=== Attempt 2 ===\nbuilt"));
        assertNull(deployment.getErrorType());

        ArgumentCaptor<RemediationRequest> captor = ArgumentCaptor.forClass(RemediationRequest.class);
        verify(advisor).propose(captor.capture(), any());
        RemediationRequest remediation = captor.getValue();
        assertEquals("build", remediation.stage());
        assertEquals("Keep alpine images", remediation.hint());
        assertEquals(1, remediation.attemptNumber());
        assertTrue(remediation.logs().contains("engine node@18"));
        assertNull(remediation.agentState());

        List<Session> sessions = orchestrator.listSessions(created.getId());
        assertEquals(1, sessions.size());

        Session session = orchestrator.getSession(created.getId(), sessions.get(0).getId());
        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        assertEquals("state-1", session.getAgentState());
        assertEquals(2, session.getFileChanges().size());
        assertEquals("Upgrade node", session.getFileChanges().get(0).reason());
        assertEquals("Node 18 is too old", session.getFileChanges().get(1).reason());
        assertNull(session.getFileChanges().get(1).before());

        List<ActivityType> activities = session.getActivityLog().stream().map(entry -> entry.type()).toList();
        assertEquals(List.of(ActivityType.TOOL_CALL, ActivityType.AI_RESPONSE), activities);

        // replaying the changes over the initial artifacts yields the current ones
        Map<String, String> replayed = new HashMap<>(Map.of("Dockerfile", DOCKERFILE));
        for (FileChange change : session.getFileChanges()) {
            assertEquals(replayed.get(change.file()), change.before());
            replayed.put(change.file(), change.after());
        }

        Map<String, String> current = new HashMap<>();
        for (ArtifactFile file : artifactStore.read("cs1")) {
            current.put(file.fileName(), file.content());
        }
        assertEquals(current, replayed);
        assertEquals(2, artifactStore.readFile("cs1", "Dockerfile").revision());
    }

    @Test
    void testDeploymentFailsWhenAttemptsAreExhausted() throws Exception {
        when(executor.build(any(), any())).thenAnswer(invocation -> CompletableFuture.completedFuture(
                BuildResult.failure("COPY failed: file not found", "exit code 1")));

        int[] calls = {0};
        when(advisor.propose(any(), any())).thenAnswer(invocation -> {
            int call = ++calls[0];
            return CompletableFuture.completedFuture(RemediationProposal.edits(List.of(
                    new FileEdit("Dockerfile", DOCKERFILE + "# fix " + call + "\n", "Try " + call)), "Attempt " + call, "state-" + call));
        });

        Deployment created = orchestrator.create(request().setMaxAttempts(3));
        Deployment deployment = awaitFinished(created.getId());

        assertEquals(DeploymentStatus.FAILED, deployment.getStatus());
        assertEquals(FailureType.EXECUTOR_FAILURE, deployment.getErrorType());
        assertTrue(deployment.getError().contains("Attempt budget of 3 is exhausted"));
        assertEquals(3, deployment.getAttemptNumber());
        assertNull(deployment.getContainerId());
        verify(executor, times(3)).build(any(), any());
        verify(executor, never()).deploy(any(), any());

        List<Session> sessions = orchestrator.listSessions(created.getId());
        assertEquals(List.of(1, 2, 3), sessions.stream().map(Session::getAttemptNumber).toList());
        assertTrue(sessions.stream().allMatch(session -> session.getStatus() == SessionStatus.COMPLETED));
        assertEquals(4, artifactStore.readFile("cs1", "Dockerfile").revision());

        ArgumentCaptor<RemediationRequest> captor = ArgumentCaptor.forClass(RemediationRequest.class);
        verify(advisor, times(3)).propose(captor.capture(), any());
        List<String> states = new ArrayList<>();
        for (RemediationRequest remediation : captor.getAllValues()) {
            states.add(remediation.agentState());
        }
        assertEquals(Arrays.asList(null, "state-1", "state-2"), states);
    }

    @Test
    void testUnfixableFailureStopsRetries() throws Exception {
        buildFails();
        when(advisor.propose(any(), any())).thenReturn(CompletableFuture.completedFuture(
                RemediationProposal.unfixable("The project needs a GPU")));

        Deployment deployment = awaitFinished(orchestrator.create(request().setMaxAttempts(5)).getId());

        assertEquals(DeploymentStatus.FAILED, deployment.getStatus());
        assertEquals(FailureType.UNFIXABLE, deployment.getErrorType());
        assertTrue(deployment.getError().contains("The project needs a GPU"));
        assertEquals(1, deployment.getAttemptNumber());
        verify(executor, times(1)).build(any(), any());

        Session session = orchestrator.listSessions(deployment.getId()).get(0);
        assertEquals(SessionStatus.FAILED, session.getStatus());
        assertEquals(FailureType.UNFIXABLE, session.getErrorType());
        assertTrue(session.getFileChanges().isEmpty());
    }

    @Test
    void testMissingRequiredFileFailsValidation() throws Exception {
        artifactStore.register(new ConfigSet().setId("cs2").setProjectId("p1"));
        artifactStore.write("cs2", "package.json", "{}", 0L);

        Deployment deployment = awaitFinished(orchestrator.create(request().setConfigSetId("cs2")).getId());

        assertEquals(DeploymentStatus.FAILED, deployment.getStatus());
        assertEquals(FailureType.VALIDATION_ERROR, deployment.getErrorType());
        assertTrue(deployment.getError().contains("Dockerfile"));
        verify(executor, never()).build(any(), any());
        verify(advisor, never()).propose(any(), any());
    }

    @Test
    void testInvalidEnvironmentVariableFailsValidation() throws Exception {
        Deployment deployment = awaitFinished(orchestrator.create(request()
                .setEnvironmentVariables(Map.of("1PORT", "3000"))).getId());

        assertEquals(FailureType.VALIDATION_ERROR, deployment.getErrorType());
        assertTrue(deployment.getError().contains("1PORT"));
        verify(executor, never()).build(any(), any());
    }

    @Test
    void testDisabledPlatformFailsValidation() throws Exception {
        Deployment deployment = awaitFinished(orchestrator.create(request().setPlatform(DeploymentPlatform.KUBERNETES)).getId());

        assertEquals(DeploymentStatus.FAILED, deployment.getStatus());
        assertEquals(FailureType.VALIDATION_ERROR, deployment.getErrorType());
        verify(executor, never()).preFlight(any());
    }

    @Test
    void testRejectedPreFlightFailsValidation() throws Exception {
        when(executor.preFlight(any())).thenReturn(CompletableFuture.completedFuture(new PreFlightResult(false,
                List.of(new PreFlightResult.Check("docker", false, "Docker daemon is not running")))));

        Deployment deployment = awaitFinished(orchestrator.create(request()).getId());

        assertEquals(FailureType.VALIDATION_ERROR, deployment.getErrorType());
        assertTrue(deployment.getError().contains("Docker daemon is not running"));
    }

    @Test
    void testResourceFaultSkipsRemediation() throws Exception {
        buildSucceeds();
        when(executor.deploy(any(), any())).thenReturn(CompletableFuture.completedFuture(
                DeployResult.failure("Bind for 0.0.0.0:3000 failed: port is already allocated", "exit code 125", false)));

        Deployment deployment = awaitFinished(orchestrator.create(request()).getId());

        assertEquals(DeploymentStatus.FAILED, deployment.getStatus());
        assertEquals(FailureType.RESOURCE_FAULT, deployment.getErrorType());
        assertTrue(deployment.getRuntimeLogs().contains("port is already allocated"));
        assertTrue(orchestrator.listSessions(deployment.getId()).isEmpty());
        verify(advisor, never()).propose(any(), any());
    }

    @Test
    void testAdvisorTimeout() throws Exception {
        buildFails();
        when(advisor.propose(any(), any())).thenAnswer(invocation -> new CompletableFuture<>());

        Deployment deployment = awaitFinished(orchestrator.create(request().setMaxAttempts(1)).getId());

        assertEquals(DeploymentStatus.FAILED, deployment.getStatus());
        assertEquals(FailureType.ADVISOR_TIMEOUT, deployment.getErrorType());
        Session session = orchestrator.listSessions(deployment.getId()).get(0);
        assertEquals(FailureType.ADVISOR_TIMEOUT, session.getErrorType());
        verify(advisor, times(1)).propose(any(), any());
    }

    @Test
    void testAdvisorErrorIsRetried() throws Exception {
        buildFails();
        when(advisor.propose(any(), any())).thenAnswer(invocation ->
                CompletableFuture.failedFuture(new IllegalStateException("Bad gateway")));

        Deployment deployment = awaitFinished(orchestrator.create(request().setMaxAttempts(1)).getId());

        assertEquals(FailureType.ADVISOR_ERROR, deployment.getErrorType());
        Session session = orchestrator.listSessions(deployment.getId()).get(0);
        assertEquals(SessionStatus.FAILED, session.getStatus());
        assertTrue(session.getError().contains("Bad gateway"));
        assertEquals(ActivityType.ERROR, session.getActivityLog().get(0).type());
        verify(advisor, times(2)).propose(any(), any());
    }

    @Test
    void testFailedSessionStillConsumesAttempt() throws Exception {
        when(executor.build(any(), any()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(BuildResult.failure("error", "exit code 1")))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(BuildResult.success("built", "img1", "web:1")));
        when(advisor.propose(any(), any())).thenAnswer(invocation ->
                CompletableFuture.failedFuture(new IllegalStateException("Bad gateway")));

        Deployment deployment = awaitFinished(orchestrator.create(request().setMaxAttempts(2)).getId());

        assertEquals(DeploymentStatus.RUNNING, deployment.getStatus());
        assertEquals(2, deployment.getAttemptNumber());
        assertEquals(SessionStatus.FAILED, orchestrator.listSessions(deployment.getId()).get(0).getStatus());
    }

    @Test
    void testInvalidAdvisorEditsConsumeAttempts() throws Exception {
        buildFails();
        int[] calls = {0};
        when(advisor.propose(any(), any())).thenAnswer(invocation -> {
            FileEdit invalid = (++calls[0] % 2 == 1)
                    ? new FileEdit(" ", "FROM node:20\n", "Blank name")
                    : new FileEdit("app.env", null, "No content");
            return CompletableFuture.completedFuture(RemediationProposal.edits(List.of(
                    new FileEdit("Dockerfile", FIXED_DOCKERFILE, "Upgrade node"), invalid), "Upgrade node", null));
        });

        Deployment deployment = awaitFinished(orchestrator.create(request().setMaxAttempts(3)).getId());

        assertEquals(DeploymentStatus.FAILED, deployment.getStatus());
        assertEquals(FailureType.ADVISOR_ERROR, deployment.getErrorType());
        assertEquals(3, deployment.getAttemptNumber());
        verify(executor, times(3)).build(any(), any());
        verify(advisor, times(6)).propose(any(), any());

        List<Session> sessions = orchestrator.listSessions(deployment.getId());
        assertEquals(3, sessions.size());
        for (Session session : sessions) {
            assertEquals(SessionStatus.FAILED, session.getStatus());
            assertEquals(FailureType.ADVISOR_ERROR, session.getErrorType());
            assertTrue(session.getError().contains("invalid edit"), session.getError());
            assertTrue(session.getFileChanges().isEmpty());
        }

        // nothing of a rejected proposal is written
        assertEquals(1, artifactStore.readFile("cs1", "Dockerfile").revision());
        assertEquals(List.of("Dockerfile"), artifactStore.read("cs1").stream().map(ArtifactFile::fileName).toList());
    }

    @Test
    void testBuildTimeoutIsTagged() throws Exception {
        when(executor.build(any(), any())).thenAnswer(invocation -> new CompletableFuture<>());
        when(advisor.propose(any(), any())).thenReturn(CompletableFuture.completedFuture(
                RemediationProposal.edits(List.of(), "Nothing to change", null)));

        JsonObject settings = settings().put("executor", new JsonObject().put("buildTimeout", 200));
        DeploymentOrchestrator timed = orchestrator(settings, System::currentTimeMillis);
        try {
            Deployment deployment = awaitFinished(timed.create(request().setMaxAttempts(1)).getId());

            assertEquals(DeploymentStatus.FAILED, deployment.getStatus());
            assertEquals(FailureType.EXECUTOR_FAILURE, deployment.getErrorType());
            assertTrue(deployment.getError().contains("Build timed out after 200 ms"), deployment.getError());

            ActivityEntry error = deployment.getActivityLog().stream()
                    .filter(entry -> entry.type() == ActivityType.ERROR)
                    .findFirst()
                    .orElseThrow();
            assertEquals(DeploymentOrchestrator.TIMEOUT, error.input());
            assertEquals(FailureType.EXECUTOR_FAILURE.name(), error.action());
        } finally {
            timed.close();
        }
    }

    @Test
    void testFunctionalBuildFailureIsNotTaggedAsTimeout() throws Exception {
        buildFails();
        when(advisor.propose(any(), any())).thenReturn(CompletableFuture.completedFuture(
                RemediationProposal.unfixable("Missing script")));

        Deployment deployment = awaitFinished(orchestrator.create(request()).getId());

        ActivityEntry error = deployment.getActivityLog().stream()
                .filter(entry -> entry.type() == ActivityType.ERROR)
                .findFirst()
                .orElseThrow();
        assertNull(error.input());
    }

    @Test
    void testConcurrentEditFailsSessionWithConflict() throws Exception {
        buildFails();
        when(advisor.propose(any(), any())).thenAnswer(invocation -> {
            artifactStore.write("cs1", "Dockerfile", "FROM alpine\n", null);
            return CompletableFuture.completedFuture(RemediationProposal.edits(
                    List.of(new FileEdit("Dockerfile", FIXED_DOCKERFILE, null)), "Upgrade node", null));
        });

        Deployment deployment = awaitFinished(orchestrator.create(request().setMaxAttempts(1)).getId());

        assertEquals(FailureType.ARTIFACT_CONFLICT, deployment.getErrorType());
        Session session = orchestrator.listSessions(deployment.getId()).get(0);
        assertEquals(FailureType.ARTIFACT_CONFLICT, session.getErrorType());
        assertTrue(session.getFileChanges().isEmpty());
        assertEquals("FROM alpine\n", artifactStore.readFile("cs1", "Dockerfile").content());
    }

    @Test
    void testCancelDuringRemediation() throws Exception {
        buildFails();
        CountDownLatch proposing = new CountDownLatch(1);
        when(advisor.propose(any(), any())).thenAnswer(invocation -> {
            proposing.countDown();
            return new CompletableFuture<>();
        });

        String id = orchestrator.create(request()).getId();
        assertTrue(proposing.await(10, TimeUnit.SECONDS));

        HttpException running = assertThrows(HttpException.class, () -> orchestrator.delete(id));
        assertEquals(HttpStatus.CONFLICT, running.getStatus());

        orchestrator.cancel(id);
        Deployment deployment = awaitFinished(id);

        assertEquals(DeploymentStatus.CANCELLED, deployment.getStatus());
        assertEquals(FailureType.CANCELLED_BY_OPERATOR, deployment.getErrorType());
        assertEquals(SessionStatus.CANCELLED, orchestrator.listSessions(id).get(0).getStatus());
        verify(executor, times(1)).build(any(), any());

        HttpException finished = assertThrows(HttpException.class, () -> orchestrator.cancel(id));
        assertEquals(HttpStatus.CONFLICT, finished.getStatus());

        orchestrator.delete(id);
        assertThrows(ResourceNotFoundException.class, () -> orchestrator.get(id));
        assertThrows(ResourceNotFoundException.class, () -> orchestrator.listSessions(id));
    }

    @Test
    void testCancelWhileBuildingDiscardsBuild() throws Exception {
        CountDownLatch building = new CountDownLatch(1);
        CompletableFuture<BuildResult> build = new CompletableFuture<>();
        when(executor.build(any(), any())).thenAnswer(invocation -> {
            building.countDown();
            return build;
        });

        String id = orchestrator.create(request()).getId();
        assertTrue(building.await(10, TimeUnit.SECONDS));

        orchestrator.cancel(id);
        build.complete(BuildResult.success("built", "img1", "web:1"));
        Deployment deployment = awaitFinished(id);

        assertEquals(DeploymentStatus.CANCELLED, deployment.getStatus());
        assertEquals(FailureType.CANCELLED_BY_OPERATOR, deployment.getErrorType());
        assertNull(deployment.getImageId());
        assertTrue(orchestrator.listSessions(id).isEmpty());
        verify(executor, never()).deploy(any(), any());
        verify(advisor, never()).propose(any(), any());
    }

    @Test
    void testCancelWhileDeployingTearsDownLateContainer() throws Exception {
        buildSucceeds();
        CountDownLatch deploying = new CountDownLatch(1);
        CompletableFuture<DeployResult> deploy = new CompletableFuture<>();
        when(executor.deploy(any(), any())).thenAnswer(invocation -> {
            deploying.countDown();
            return deploy;
        });

        String id = orchestrator.create(request()).getId();
        assertTrue(deploying.await(10, TimeUnit.SECONDS));

        orchestrator.cancel(id);
        Deployment deployment = awaitFinished(id);
        assertEquals(DeploymentStatus.CANCELLED, deployment.getStatus());

        // the container comes up after the deployment is cancelled
        deploy.complete(DeployResult.success("listening on 3000", "c9", List.of(), "http://localhost:32769"));

        verify(executor, timeout(5_000)).teardown(id, "c9");
        Deployment cancelled = orchestrator.get(id);
        assertEquals(DeploymentStatus.CANCELLED, cancelled.getStatus());
        assertNull(cancelled.getContainerId());
        assertNull(cancelled.getDeployUrl());
    }

    @Test
    void testCancelAcceptedBeforeRunningIsWritten() throws Exception {
        buildSucceeds();
        AtomicReference<String> deployed = new AtomicReference<>();
        when(executor.deploy(any(), any())).thenAnswer(invocation -> {
            DeployRequest request = invocation.getArgument(0);
            deployed.set(request.deploymentId());
            return CompletableFuture.completedFuture(
                    DeployResult.success("listening on 3000", "c1", List.of(), "http://localhost:32768"));
        });

        // the first clock read after the deploy happens while the running record is being written
        LongSupplier clock = () -> {
            String id = deployed.getAndSet(null);
            if (id != null) {
                registry.get(id).cancel();
            }
            return System.currentTimeMillis();
        };

        DeploymentOrchestrator racing = orchestrator(settings(), clock);
        try {
            String id = racing.create(request()).getId();
            Deployment deployment = awaitFinished(id);

            assertEquals(DeploymentStatus.CANCELLED, deployment.getStatus());
            assertEquals(FailureType.CANCELLED_BY_OPERATOR, deployment.getErrorType());
            assertNull(deployment.getContainerId());
            assertTrue(deployment.getActivityLog().stream().noneMatch(entry -> "running".equals(entry.output())));
            verify(executor).teardown(id, "c1");
        } finally {
            racing.close();
        }
    }

    @Test
    void testCancelWinsOverFailureInFlight() throws Exception {
        buildFails();
        AtomicReference<String> answered = new AtomicReference<>();
        when(advisor.propose(any(), any())).thenAnswer(invocation -> {
            RemediationRequest remediation = invocation.getArgument(0);
            answered.set(remediation.deploymentId());
            return CompletableFuture.completedFuture(RemediationProposal.unfixable("The project needs a GPU"));
        });

        // cancels while the session is finishing, after the last cancellation boundary of the attempt
        LongSupplier clock = () -> {
            String id = answered.getAndSet(null);
            if (id != null) {
                registry.get(id).cancel();
            }
            return System.currentTimeMillis();
        };

        DeploymentOrchestrator racing = orchestrator(settings(), clock);
        try {
            Deployment deployment = awaitFinished(racing.create(request().setMaxAttempts(3)).getId());

            assertEquals(DeploymentStatus.CANCELLED, deployment.getStatus());
            assertEquals(FailureType.CANCELLED_BY_OPERATOR, deployment.getErrorType());
            assertEquals("Cancelled by operator", deployment.getError());
        } finally {
            racing.close();
        }
    }

    @Test
    void testLateAdvisorResponseAppliesNoChanges() throws Exception {
        buildFails();
        CountDownLatch proposing = new CountDownLatch(1);
        CompletableFuture<RemediationProposal> proposal = new CompletableFuture<>();
        when(advisor.propose(any(), any())).thenAnswer(invocation -> {
            proposing.countDown();
            return proposal;
        });

        String id = orchestrator.create(request()).getId();
        assertTrue(proposing.await(10, TimeUnit.SECONDS));

        orchestrator.cancel(id);
        proposal.complete(RemediationProposal.edits(List.of(
                new FileEdit("Dockerfile", FIXED_DOCKERFILE, "Upgrade node")), "Node 18 is too old", "state-1"));
        Deployment deployment = awaitFinished(id);

        assertEquals(DeploymentStatus.CANCELLED, deployment.getStatus());
        Session session = orchestrator.listSessions(id).get(0);
        assertEquals(SessionStatus.CANCELLED, session.getStatus());
        assertTrue(session.getFileChanges().isEmpty());
        assertEquals(1, artifactStore.readFile("cs1", "Dockerfile").revision());
        assertEquals(DOCKERFILE, artifactStore.readFile("cs1", "Dockerfile").content());
        verify(executor, times(1)).build(any(), any());
    }

    @Test
    void testCancelWithoutExecution() {
        long now = System.currentTimeMillis();
        store.createDeployment(new Deployment().setId("d1").setConfigSetId("cs1").setStatus(DeploymentStatus.PENDING)
                .setAttemptNumber(1).setMaxAttempts(3).setCreatedAt(now));

        Deployment deployment = orchestrator.cancel("d1");

        assertEquals(DeploymentStatus.CANCELLED, deployment.getStatus());
        assertEquals(DeploymentStatus.CANCELLED, orchestrator.get("d1").getStatus());
    }

    @Test
    void testCreateValidatesRequest() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.create(new CreateDeploymentRequest()));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.create(request().setMaxAttempts(0)));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.create(request().setMaxAttempts(11)));
        assertThrows(ResourceNotFoundException.class, () -> orchestrator.get("missing"));
    }

    @Test
    void testList() throws Exception {
        buildSucceeds();
        String first = orchestrator.create(request()).getId();
        awaitFinished(first);
        Thread.sleep(5);
        String second = orchestrator.create(request().setProjectId("p2")).getId();
        awaitFinished(second);

        ListResponse<Deployment> all = orchestrator.list(new DeploymentFilter());
        assertEquals(2, all.total());
        assertEquals(List.of(second, first), all.items().stream().map(Deployment::getId).toList());

        ListResponse<Deployment> page = orchestrator.list(new DeploymentFilter().setLimit(1).setOffset(1));
        assertEquals(2, page.total());
        assertEquals(List.of(first), page.items().stream().map(Deployment::getId).toList());

        ListResponse<Deployment> rest = orchestrator.list(new DeploymentFilter().setLimit(Integer.MAX_VALUE).setOffset(1));
        assertEquals(List.of(first), rest.items().stream().map(Deployment::getId).toList());

        ListResponse<Deployment> project = orchestrator.list(new DeploymentFilter().setProjectId("p2"));
        assertEquals(List.of(second), project.items().stream().map(Deployment::getId).toList());

        ListResponse<Deployment> failed = orchestrator.list(new DeploymentFilter().setStatus(DeploymentStatus.FAILED));
        assertEquals(0, failed.total());
    }

    @Test
    void testHealthCheckDegradesAndRecovers() throws Exception {
        buildSucceeds();
        String id = orchestrator.create(request()).getId();
        awaitFinished(id);

        when(executor.healthCheck(id, "c1"))
                .thenReturn(CompletableFuture.completedFuture(HealthStatus.DEGRADED));
        orchestrator.checkHealth();
        assertEquals(DeploymentStatus.DEGRADED, orchestrator.get(id).getStatus());

        when(executor.healthCheck(id, "c1")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));
        orchestrator.checkHealth();
        assertEquals(DeploymentStatus.DEGRADED, orchestrator.get(id).getStatus());

        when(executor.healthCheck(id, "c1")).thenReturn(CompletableFuture.completedFuture(HealthStatus.OK));
        orchestrator.checkHealth();
        Deployment deployment = orchestrator.get(id);
        assertEquals(DeploymentStatus.RUNNING, deployment.getStatus());
        assertEquals("c1", deployment.getContainerId());
    }

    @Test
    void testDeleteTearsDownContainer() throws Exception {
        buildSucceeds();
        String id = orchestrator.create(request()).getId();
        awaitFinished(id);

        orchestrator.delete(id);

        verify(executor).teardown(id, "c1");
        assertNull(store.getDeployment(id));
    }

    @Test
    void testRecoverFailsInterruptedDeployments() {
        long now = System.currentTimeMillis();
        store.createDeployment(new Deployment().setId("d1").setConfigSetId("cs1").setStatus(DeploymentStatus.BUILDING)
                .setAttemptNumber(1).setMaxAttempts(3).setCreatedAt(now));
        store.saveSession(new Session().setId("s1").setDeploymentId("d1").setAttemptNumber(1)
                .setStatus(SessionStatus.ACTIVE).setStartedAt(now));
        store.createDeployment(new Deployment().setId("d2").setConfigSetId("cs1").setStatus(DeploymentStatus.RUNNING)
                .setContainerId("c2").setAttemptNumber(1).setMaxAttempts(3).setCreatedAt(now));

        orchestrator.recover();

        Deployment interrupted = orchestrator.get("d1");
        assertEquals(DeploymentStatus.FAILED, interrupted.getStatus());
        assertEquals(FailureType.EXECUTOR_FAILURE, interrupted.getErrorType());
        assertEquals("Interrupted by service restart", interrupted.getError());

        Session session = orchestrator.getSession("d1", "s1");
        assertEquals(SessionStatus.FAILED, session.getStatus());
        assertEquals("Interrupted by service restart", session.getError());

        when(executor.healthCheck("d2", "c2")).thenReturn(CompletableFuture.completedFuture(HealthStatus.DEGRADED));
        orchestrator.checkHealth();
        assertEquals(DeploymentStatus.DEGRADED, orchestrator.get("d2").getStatus());
    }

    private JsonObject settings() {
        return new JsonObject()
                .put("deployments", new JsonObject()
                        .put("platforms", new JsonArray().add("docker"))
                        .put("healthCheckPeriod", 0))
                .put("artifacts", new JsonObject()
                        .put("requiredFiles", new JsonArray().add("Dockerfile")))
                .put("advisor", new JsonObject()
                        .put("timeout", 1000)
                        .put("retries", 1)
                        .put("retryDelay", 10));
    }

    private DeploymentOrchestrator orchestrator(JsonObject settings, LongSupplier clock) {
        return new DeploymentOrchestrator(vertx, store, artifactStore, executor, advisor, broadcaster, registry,
                settings, clock, () -> UUID.randomUUID().toString());
    }

    private void buildSucceeds() {
        when(executor.build(any(), any())).thenAnswer(invocation -> {
            Consumer<String> listener = invocation.getArgument(1);
            listener.accept("Step 1/2 : FROM node:18\n");
            return CompletableFuture.completedFuture(BuildResult.success("Step 1/2 : FROM node:18\n", "img1", "web:1"));
        });
    }

    private void buildFails() {
        when(executor.build(any(), any())).thenAnswer(invocation -> CompletableFuture.completedFuture(
                BuildResult.failure("npm ERR! missing script: build", "exit code 1")));
    }

    private static CreateDeploymentRequest request() {
        return new CreateDeploymentRequest().setConfigSetId("cs1").setName("web");
    }

    private Deployment awaitFinished(String deploymentId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            Deployment deployment = store.getDeployment(deploymentId);
            if (deployment != null && deployment.getStatus().isFinished() && registry.get(deploymentId) == null) {
                return deployment;
            }
            Thread.sleep(20);
        }
        return fail("Deployment is not finished: " + deploymentId);
    }
}
