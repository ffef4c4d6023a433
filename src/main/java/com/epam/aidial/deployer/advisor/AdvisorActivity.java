package com.epam.aidial.deployer.advisor;

import com.epam.aidial.deployer.data.ActivityType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import javax.annotation.Nullable;

/**
 * Tool invocation reported by the advisor while it works.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdvisorActivity(ActivityType type, String action, @Nullable String input, @Nullable String output) {
}
