package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonInclude;

import javax.annotation.Nullable;

/**
 * One entry of an append-only audit trail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivityEntry(String id,
                            ActivityType type,
                            String action,
                            @Nullable String input,
                            @Nullable String output,
                            long timestamp) {
}
