package com.epam.aidial.deployer.controller;

import io.vertx.core.Future;

import java.io.Serializable;

/**
 * Common interface for HTTP controllers.
 */
@FunctionalInterface
public interface Controller extends Serializable {

    /**
     * The controller must return non-null instance of {@link Future}.
     */
    Future<?> handle() throws Exception;
}
