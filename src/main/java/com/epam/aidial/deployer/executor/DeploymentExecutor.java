package com.epam.aidial.deployer.executor;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Builds artifacts into an image and runs it. Implementations keep no state between calls
 * beyond what the requests carry.
 *
 * <p>Build and deploy failures complete the future normally with an unsuccessful result.
 * An exceptional completion means the executor itself could not be reached or misbehaved.</p>
 */
public interface DeploymentExecutor {

    boolean isAvailable();

    CompletableFuture<PreFlightResult> preFlight(PreFlightRequest request);

    /**
     * @param logListener receives build log lines as they arrive
     */
    CompletableFuture<BuildResult> build(BuildRequest request, Consumer<String> logListener);

    CompletableFuture<DeployResult> deploy(DeployRequest request, Consumer<String> logListener);

    CompletableFuture<HealthStatus> healthCheck(String deploymentId, String containerId);

    CompletableFuture<String> logs(String deploymentId, String containerId);

    CompletableFuture<Void> teardown(String deploymentId, String containerId);
}
