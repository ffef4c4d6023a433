package com.epam.aidial.deployer.advisor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import javax.annotation.Nullable;

/**
 * Proposed full content of a file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileEdit(String file, String content, @Nullable String reason) {
}
