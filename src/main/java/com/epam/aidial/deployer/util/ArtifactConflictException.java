package com.epam.aidial.deployer.util;

/**
 * Thrown when an artifact write loses an optimistic revision check or cannot get the file lock in time.
 */
public class ArtifactConflictException extends HttpException {

    public ArtifactConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
