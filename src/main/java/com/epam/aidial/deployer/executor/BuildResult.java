package com.epam.aidial.deployer.executor;

import javax.annotation.Nullable;

/**
 * Outcome of an image build. A failed build is a regular result, not an exception.
 */
public record BuildResult(boolean success,
                          String logs,
                          @Nullable String imageId,
                          @Nullable String imageTag,
                          @Nullable String error) {

    public static BuildResult success(String logs, String imageId, String imageTag) {
        return new BuildResult(true, logs, imageId, imageTag, null);
    }

    public static BuildResult failure(String logs, String error) {
        return new BuildResult(false, logs, null, null, error);
    }
}
