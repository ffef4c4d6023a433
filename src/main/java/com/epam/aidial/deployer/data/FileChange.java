package com.epam.aidial.deployer.data;

import javax.annotation.Nullable;

/**
 * A committed artifact edit.
 *
 * @param before content replaced by the edit, null for a new file
 * @param after  content written by the edit
 */
public record FileChange(String file,
                         @Nullable String before,
                         String after,
                         String reason,
                         long timestamp) {
}
