package com.epam.aidial.deployer.executor;

import com.epam.aidial.deployer.client.ServiceClient;
import com.epam.aidial.deployer.data.DeploymentPlatform;
import com.epam.aidial.deployer.data.PortMapping;
import com.epam.aidial.deployer.util.JsonUtil;
import com.epam.aidial.deployer.util.ServerSentEvent;
import com.epam.aidial.deployer.util.UrlUtil;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A web client to the deployment controller service that builds images and runs containers.
 * Long operations answer with an event stream: {@code log} events, then a {@code result} or an {@code error}.
 */
@Slf4j
public class ControllerDeploymentExecutor implements DeploymentExecutor {

    private final ServiceClient client;

    public ControllerDeploymentExecutor(HttpClient client, JsonObject settings) {
        this.client = new ServiceClient(client, "deployment controller",
                settings.getString("endpoint"), settings.getLong("idleTimeout", 600_000L));
    }

    @Override
    public boolean isAvailable() {
        return client.isActive();
    }

    @Override
    public CompletableFuture<PreFlightResult> preFlight(PreFlightRequest request) {
        return client.call(HttpMethod.POST, "/v1/preflight", request, PreFlightResult.class);
    }

    @Override
    public CompletableFuture<BuildResult> build(BuildRequest request, Consumer<String> logListener) {
        CreateImageRequest body = new CreateImageRequest(request.configSetId(), request.platform(),
                request.attemptNumber(), request.files().stream()
                .map(file -> new ImageFile(file.fileName(), file.content()))
                .toList());

        StringBuilder logs = new StringBuilder();
        return client.stream(HttpMethod.POST, "/v1/image/" + UrlUtil.encodePathSegment(request.deploymentId()), body,
                event -> switch (event.event()) {
                    case "log" -> {
                        appendLog(event, logs, logListener);
                        yield null;
                    }
                    case "result" -> {
                        CreateImageResponse image = convert(event, CreateImageResponse.class);
                        yield BuildResult.success(logs.toString(), image.imageId(), image.imageTag());
                    }
                    case "error" -> {
                        ErrorResponse error = convert(event, ErrorResponse.class);
                        yield BuildResult.failure(withLogs(logs, error), error.message());
                    }
                    default -> throw invalidEvent(event);
                });
    }

    @Override
    public CompletableFuture<DeployResult> deploy(DeployRequest request, Consumer<String> logListener) {
        CreateDeploymentRequest body = new CreateDeploymentRequest(request.platform(), request.imageId(), request.imageTag(),
                request.environment(), request.environmentVariables());

        StringBuilder logs = new StringBuilder();
        return client.stream(HttpMethod.POST, "/v1/deployment/" + UrlUtil.encodePathSegment(request.deploymentId()), body,
                event -> switch (event.event()) {
                    case "log" -> {
                        appendLog(event, logs, logListener);
                        yield null;
                    }
                    case "result" -> {
                        CreateDeploymentResponse deployment = convert(event, CreateDeploymentResponse.class);
                        List<PortMapping> ports = (deployment.ports() == null) ? List.of() : deployment.ports();
                        yield DeployResult.success(logs.toString(), deployment.containerId(), ports, deployment.url());
                    }
                    case "error" -> {
                        ErrorResponse error = convert(event, ErrorResponse.class);
                        yield DeployResult.failure(withLogs(logs, error), error.message(), error.resourceFault());
                    }
                    default -> throw invalidEvent(event);
                });
    }

    @Override
    public CompletableFuture<HealthStatus> healthCheck(String deploymentId, String containerId) {
        return client.call(HttpMethod.GET, deploymentPath(deploymentId) + "/health", null, HealthResponse.class)
                .thenApply(response -> "ok".equalsIgnoreCase(response.status()) ? HealthStatus.OK : HealthStatus.DEGRADED);
    }

    @Override
    public CompletableFuture<String> logs(String deploymentId, String containerId) {
        return client.call(HttpMethod.GET, deploymentPath(deploymentId) + "/logs", null, LogsResponse.class)
                .thenApply(LogsResponse::logs);
    }

    @Override
    public CompletableFuture<Void> teardown(String deploymentId, String containerId) {
        return client.call(HttpMethod.DELETE, deploymentPath(deploymentId), null, Void.class);
    }

    private static String deploymentPath(String deploymentId) {
        return "/v1/deployment/" + UrlUtil.encodePathSegment(deploymentId);
    }

    private static void appendLog(ServerSentEvent event, StringBuilder logs, Consumer<String> logListener) {
        LogLine line = convert(event, LogLine.class);
        String text = line.line() + "\n";
        logs.append(text);
        try {
            logListener.accept(text);
        } catch (Throwable e) {
            log.warn("Can't pass a log line", e);
        }
    }

    private static String withLogs(StringBuilder logs, ErrorResponse error) {
        if (error.logs() != null) {
            logs.append(error.logs());
        }
        return logs.toString();
    }

    private static <T> T convert(ServerSentEvent event, Class<T> clazz) {
        T value = JsonUtil.convertToObject(event.data(), clazz);
        if (value == null) {
            throw new IllegalStateException("Invalid response. No data in event: " + event.event());
        }
        return value;
    }

    private static IllegalStateException invalidEvent(ServerSentEvent event) {
        return new IllegalStateException("Invalid response. Invalid event: " + event.event());
    }

    private record ImageFile(String name, String content) {
    }

    private record CreateImageRequest(String configSetId, DeploymentPlatform platform, int attempt, List<ImageFile> files) {
    }

    private record CreateDeploymentRequest(DeploymentPlatform platform, String imageId, String imageTag,
                                           String environment, Map<String, String> env) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record CreateImageResponse(String imageId, String imageTag) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record CreateDeploymentResponse(String containerId, List<PortMapping> ports, String url) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record LogLine(String line) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record HealthResponse(String status) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record LogsResponse(String logs) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ErrorResponse(String message, String logs, boolean resourceFault) {
    }
}
