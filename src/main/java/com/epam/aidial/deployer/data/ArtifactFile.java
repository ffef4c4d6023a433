package com.epam.aidial.deployer.data;

/**
 * Head revision of a config set file.
 */
public record ArtifactFile(String fileName, String content, long revision) {
}
