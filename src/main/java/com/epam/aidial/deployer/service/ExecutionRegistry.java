package com.epam.aidial.deployer.service;

import com.epam.aidial.deployer.util.CallTimeoutException;
import com.epam.aidial.deployer.util.FutureUtil;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/**
 * Exclusive execution tokens: deployment id to its running execution, which holds the id of the active session.
 * Only the holder of a token may transition the deployment, and a token admits one active session at a time.
 */
@Slf4j
public class ExecutionRegistry {

    private final ConcurrentMap<String, Execution> executions = new ConcurrentHashMap<>();

    public Execution acquire(String deploymentId) {
        Execution execution = new Execution(deploymentId);
        if (executions.putIfAbsent(deploymentId, execution) != null) {
            throw new IllegalStateException("Deployment is already executing: " + deploymentId);
        }
        return execution;
    }

    @Nullable
    public Execution get(String deploymentId) {
        return executions.get(deploymentId);
    }

    public void release(Execution execution) {
        executions.remove(execution.getDeploymentId(), execution);
    }

    public int size() {
        return executions.size();
    }

    @RequiredArgsConstructor
    public static class Execution {

        @Getter
        private final String deploymentId;
        private final CompletableFuture<Void> cancellation = new CompletableFuture<>();
        private final AtomicReference<String> activeSession = new AtomicReference<>();

        /**
         * @return true if this call requested the cancellation
         */
        public boolean cancel() {
            return cancellation.complete(null);
        }

        public boolean isCancelled() {
            return cancellation.isDone();
        }

        /**
         * Cancellation boundary.
         *
         * @throws CancellationException if the cancellation is requested
         */
        public void checkpoint() {
            if (isCancelled()) {
                throw new CancellationException("Cancelled by operator");
            }
        }

        @Nullable
        public String getActiveSession() {
            return activeSession.get();
        }

        public void activate(String sessionId) {
            if (!activeSession.compareAndSet(null, sessionId)) {
                throw new IllegalStateException("Deployment %s already has active session %s".formatted(deploymentId, activeSession.get()));
            }
        }

        public void deactivate(String sessionId) {
            if (!activeSession.compareAndSet(sessionId, null)) {
                log.warn("Session {} is not active in deployment {}", sessionId, deploymentId);
            }
        }

        /**
         * Sleeps unless the cancellation is requested.
         *
         * @throws CancellationException if the cancellation is requested before or during the pause
         */
        @SneakyThrows
        public void pause(long delay) {
            checkpoint();
            try {
                cancellation.get(delay, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                return;
            }
            checkpoint();
        }

        /**
         * Waits for an external call. A cancellation interrupts the wait but not the call, its result is discarded.
         *
         * @throws CancellationException if the cancellation is requested before or during the call
         * @throws CallTimeoutException if the call does not complete within the timeout
         */
        @SneakyThrows
        public <T> T await(CompletableFuture<T> future, long timeout, String operation) {
            checkpoint();

            try {
                CompletableFuture.anyOf(future, cancellation)
                        .handle((result, error) -> null)
                        .get(timeout, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new CallTimeoutException(operation, timeout);
            }

            checkpoint();
            return FutureUtil.result(future);
        }
    }
}
