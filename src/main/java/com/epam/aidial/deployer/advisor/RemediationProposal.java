package com.epam.aidial.deployer.advisor;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Answer of the advisor: either edits with a rationale, or a refusal.
 */
public record RemediationProposal(boolean unfixable,
                                  List<FileEdit> edits,
                                  @Nullable String rationale,
                                  @Nullable String agentState) {

    public static RemediationProposal edits(List<FileEdit> edits, String rationale, @Nullable String agentState) {
        return new RemediationProposal(false, edits, rationale, agentState);
    }

    public static RemediationProposal unfixable(String reason) {
        return new RemediationProposal(true, List.of(), reason, null);
    }
}
