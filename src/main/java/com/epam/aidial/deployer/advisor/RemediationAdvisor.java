package com.epam.aidial.deployer.advisor;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * External capability proposing artifact edits for a failure.
 */
public interface RemediationAdvisor {

    boolean isAvailable();

    /**
     * @param activityListener receives tool invocations in the order the advisor reports them
     */
    CompletableFuture<RemediationProposal> propose(RemediationRequest request, Consumer<AdvisorActivity> activityListener);
}
