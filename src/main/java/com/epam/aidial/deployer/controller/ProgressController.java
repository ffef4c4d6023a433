package com.epam.aidial.deployer.controller;

import com.epam.aidial.deployer.ApiContext;
import com.epam.aidial.deployer.DeployerApi;
import com.epam.aidial.deployer.data.ProgressEvent;
import com.epam.aidial.deployer.data.ProgressEventType;
import com.epam.aidial.deployer.service.DeploymentOrchestrator;
import com.epam.aidial.deployer.service.ProgressBroadcaster;
import com.epam.aidial.deployer.util.JsonUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Server-sent event streams of deployment and session progress.
 * A stream starts with a {@code connected} snapshot and ends after the {@code done} event.
 */
@Slf4j
public class ProgressController {

    private final ApiContext context;
    private final Vertx vertx;
    private final DeploymentOrchestrator orchestrator;
    private final ProgressBroadcaster broadcaster;

    public ProgressController(DeployerApi api, ApiContext context) {
        this.context = context;
        this.vertx = api.getVertx();
        this.orchestrator = api.getOrchestrator();
        this.broadcaster = api.getBroadcaster();
    }

    public Future<?> subscribeDeployment(String deploymentId) {
        return subscribe(deploymentId, () -> orchestrator.snapshot(deploymentId));
    }

    public Future<?> subscribeSession(String deploymentId, String sessionId) {
        return subscribe(sessionId, () -> orchestrator.sessionSnapshot(deploymentId, sessionId));
    }

    private Future<?> subscribe(String id, Supplier<ProgressBroadcaster.Snapshot> fallback) {
        HttpServerResponse response = context.getResponse();

        vertx.executeBlocking(fallback::get, false)
                .compose(snapshot -> {
                    response.setChunked(true)
                            .setStatusCode(200)
                            .putHeader(HttpHeaders.CONTENT_TYPE, "text/event-stream")
                            .putHeader(HttpHeaders.CACHE_CONTROL, "no-cache")
                            .putHeader("X-Accel-Buffering", "no")
                            .write(""); // to force writing header

                    return vertx.executeBlocking(() -> broadcaster.subscribe(id, () -> snapshot, this::send), false);
                })
                .onSuccess(subscription -> {
                    response.closeHandler(event -> subscription.close());
                    if (response.closed()) {
                        subscription.close();
                    }
                })
                .onFailure(context::respond);

        return Future.succeededFuture();
    }

    private void send(ProgressEvent event) {
        HttpServerResponse response = context.getResponse();
        String json = JsonUtil.convertToString(event);
        response.write("data: " + json + "\n\n");

        if (event.getType() == ProgressEventType.DONE) {
            response.end();
        }
    }
}
