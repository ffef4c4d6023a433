package com.epam.aidial.deployer.controller;

import com.epam.aidial.deployer.ApiContext;
import com.epam.aidial.deployer.DeployerApi;
import com.epam.aidial.deployer.data.CreateDeploymentRequest;
import com.epam.aidial.deployer.data.DeploymentFilter;
import com.epam.aidial.deployer.data.DeploymentStatus;
import com.epam.aidial.deployer.data.ListResponse;
import com.epam.aidial.deployer.service.DeploymentOrchestrator;
import com.epam.aidial.deployer.util.HttpStatus;
import com.epam.aidial.deployer.util.JsonUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;

@Slf4j
public class DeploymentController {

    private final ApiContext context;
    private final Vertx vertx;
    private final DeploymentOrchestrator orchestrator;

    public DeploymentController(DeployerApi api, ApiContext context) {
        this.context = context;
        this.vertx = api.getVertx();
        this.orchestrator = api.getOrchestrator();
    }

    public Future<?> createDeployment() {
        context.getRequest()
                .body()
                .compose(buffer -> {
                    CreateDeploymentRequest request;
                    try {
                        request = JsonUtil.convertToObject(buffer, CreateDeploymentRequest.class);
                    } catch (Exception e) {
                        log.error("Invalid request body provided", e);
                        throw new IllegalArgumentException("Can't create deployment. Incorrect body provided");
                    }

                    if (request == null) {
                        throw new IllegalArgumentException("Can't create deployment. Body must be provided");
                    }

                    return vertx.executeBlocking(() -> orchestrator.create(request), false);
                })
                .onSuccess(deployment -> context.respond(HttpStatus.OK, deployment))
                .onFailure(context::respond);

        return Future.succeededFuture();
    }

    public Future<?> getDeployments() {
        DeploymentFilter filter = new DeploymentFilter()
                .setProjectId(context.getQueryParam("projectId"))
                .setConfigSetId(context.getQueryParam("configSetId"))
                .setLimit(context.getIntQueryParam("limit", 100))
                .setOffset(context.getIntQueryParam("offset", 0));

        String status = context.getQueryParam("status");
        if (status != null) {
            filter.setStatus(DeploymentStatus.fromValue(status));
        }

        if (filter.getLimit() < 0 || filter.getOffset() < 0) {
            throw new IllegalArgumentException("Limit and offset must not be negative");
        }

        return respondBlocking(() -> orchestrator.list(filter));
    }

    public Future<?> getDeployment(String deploymentId) {
        return respondBlocking(() -> orchestrator.get(deploymentId));
    }

    public Future<?> deleteDeployment(String deploymentId) {
        vertx.executeBlocking(() -> {
                    orchestrator.delete(deploymentId);
                    return null;
                }, false)
                .onSuccess(ignore -> context.respond(HttpStatus.OK))
                .onFailure(context::respond);

        return Future.succeededFuture();
    }

    public Future<?> cancelDeployment(String deploymentId) {
        return respondBlocking(() -> orchestrator.cancel(deploymentId));
    }

    public Future<?> getLogs(String deploymentId) {
        return respondBlocking(() -> orchestrator.logs(deploymentId));
    }

    public Future<?> getSessions(String deploymentId) {
        return respondBlocking(() -> {
            var sessions = orchestrator.listSessions(deploymentId);
            return new ListResponse<>(sessions, sessions.size());
        });
    }

    public Future<?> getSession(String deploymentId, String sessionId) {
        return respondBlocking(() -> orchestrator.getSession(deploymentId, sessionId));
    }

    private Future<?> respondBlocking(Callable<?> action) {
        vertx.executeBlocking(action, false)
                .onSuccess(result -> context.respond(HttpStatus.OK, result))
                .onFailure(context::respond);

        return Future.succeededFuture();
    }
}
