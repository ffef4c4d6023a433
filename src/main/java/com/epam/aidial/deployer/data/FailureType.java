package com.epam.aidial.deployer.data;

public enum FailureType {
    /**
     * Pre-flight rejection, never retried.
     */
    VALIDATION_ERROR,
    /**
     * Build or deploy failure, drives the remediation loop.
     */
    EXECUTOR_FAILURE,
    ADVISOR_TIMEOUT,
    ADVISOR_ERROR,
    UNFIXABLE,
    ARTIFACT_CONFLICT,
    /**
     * Unrecoverable deploy-time fault, fails the deployment without remediation.
     */
    RESOURCE_FAULT,
    CANCELLED_BY_OPERATOR
}
