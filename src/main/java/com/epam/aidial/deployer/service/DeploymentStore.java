package com.epam.aidial.deployer.service;

import com.epam.aidial.deployer.data.Deployment;
import com.epam.aidial.deployer.data.DeploymentFilter;
import com.epam.aidial.deployer.data.Session;
import com.epam.aidial.deployer.storage.BlobStorage;
import com.epam.aidial.deployer.storage.BlobStorageUtil;
import com.epam.aidial.deployer.util.JsonUtil;
import com.epam.aidial.deployer.util.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;

/**
 * Durable deployment and session records. A deployment folder owns the folders of its sessions.
 */
@Slf4j
@RequiredArgsConstructor
public class DeploymentStore {

    private static final String DEPLOYMENT_FILE = "/deployment.json";

    private final BlobStorage storage;
    private final LockService lockService;

    public void createDeployment(Deployment deployment) {
        String path = BlobStorageUtil.deploymentPath(deployment.getId());
        lockService.underLock(path, () -> {
            if (storage.exists(path)) {
                throw new IllegalStateException("Deployment already exists: " + deployment.getId());
            }
            storage.store(path, JsonUtil.convertToString(deployment));
            return null;
        });
    }

    @Nullable
    public Deployment getDeployment(String deploymentId) {
        String json = storage.load(BlobStorageUtil.deploymentPath(deploymentId));
        return JsonUtil.convertToObject(json, Deployment.class);
    }

    public Deployment verifyDeployment(String deploymentId) {
        Deployment deployment = getDeployment(deploymentId);
        if (deployment == null) {
            throw new ResourceNotFoundException("Deployment is not found: " + deploymentId);
        }
        return deployment;
    }

    /**
     * Read-modify-write of a deployment record under its lock.
     *
     * @return the stored record
     */
    public Deployment computeDeployment(String deploymentId, UnaryOperator<Deployment> fn) {
        String path = BlobStorageUtil.deploymentPath(deploymentId);
        try (var ignored = lockService.lock(path)) {
            Deployment deployment = verifyDeployment(deploymentId);
            Deployment updated = fn.apply(deployment);
            storage.store(path, JsonUtil.convertToString(updated));
            return updated;
        }
    }

    /**
     * @return matching deployments, newest first
     */
    public List<Deployment> listDeployments(DeploymentFilter filter) {
        List<Deployment> deployments = new ArrayList<>();

        for (String path : storage.list(BlobStorageUtil.DEPLOYMENTS_LOCATION)) {
            if (!path.endsWith(DEPLOYMENT_FILE)) {
                continue;
            }

            Deployment deployment = JsonUtil.convertToObject(storage.load(path), Deployment.class);
            if (deployment != null && filter.matches(deployment)) {
                deployments.add(deployment);
            }
        }

        deployments.sort(Comparator.comparing(Deployment::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return deployments;
    }

    public void deleteDeployment(String deploymentId) {
        String path = BlobStorageUtil.deploymentPath(deploymentId);
        try (var ignored = lockService.lock(path)) {
            storage.deleteFolder(BlobStorageUtil.deploymentFolder(deploymentId));
        }
        log.info("Deployment deleted: {}", deploymentId);
    }

    public void saveSession(Session session) {
        storage.store(BlobStorageUtil.sessionPath(session.getDeploymentId(), session.getId()), JsonUtil.convertToString(session));
    }

    @Nullable
    public Session getSession(String deploymentId, String sessionId) {
        String json = storage.load(BlobStorageUtil.sessionPath(deploymentId, sessionId));
        return JsonUtil.convertToObject(json, Session.class);
    }

    public Session verifySession(String deploymentId, String sessionId) {
        Session session = getSession(deploymentId, sessionId);
        if (session == null) {
            throw new ResourceNotFoundException("Session %s is not found in deployment %s".formatted(sessionId, deploymentId));
        }
        return session;
    }

    /**
     * @return sessions of the deployment ordered by attempt
     */
    public List<Session> listSessions(String deploymentId) {
        List<Session> sessions = new ArrayList<>();
        for (String path : storage.list(BlobStorageUtil.sessionFolder(deploymentId))) {
            Session session = JsonUtil.convertToObject(storage.load(path), Session.class);
            if (session != null) {
                sessions.add(session);
            }
        }

        sessions.sort(Comparator.comparingInt(Session::getAttemptNumber));
        return sessions;
    }
}
