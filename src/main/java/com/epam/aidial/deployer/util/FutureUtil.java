package com.epam.aidial.deployer.util;

import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@UtilityClass
public class FutureUtil {

    /**
     * Waits for a call to an external collaborator.
     * On timeout the future is cancelled, so the client side can reset the underlying request.
     *
     * @throws CallTimeoutException if the call does not complete within the timeout
     */
    @SneakyThrows
    public <T> T await(CompletableFuture<T> future, long timeout, String operation) {
        try {
            return future.get(timeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CallTimeoutException(operation, timeout);
        } catch (ExecutionException e) {
            throw e.getCause();
        }
    }

    /**
     * Returns the result of an already completed future, rethrowing its failure as is.
     */
    @SneakyThrows
    public <T> T result(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw e.getCause();
        }
    }
}
