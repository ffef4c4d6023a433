package com.epam.aidial.deployer;

import com.epam.aidial.deployer.util.HttpException;
import com.epam.aidial.deployer.util.HttpStatus;
import com.epam.aidial.deployer.util.JsonUtil;
import io.vertx.core.Future;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

@Slf4j
@Getter
public class ApiContext {

    private static final int LOG_MAX_ERROR_LENGTH = 200;

    private final HttpServerRequest request;
    private final HttpServerResponse response;
    private final long requestTimestamp;

    public ApiContext(HttpServerRequest request) {
        this.request = request;
        this.response = request.response();
        this.requestTimestamp = System.currentTimeMillis();
    }

    public Future<?> respond(HttpStatus status) {
        return respond(status, (String) null);
    }

    public Future<?> respond(HttpStatus status, Object object) {
        String json = JsonUtil.convertToString(object);
        response.putHeader(HttpHeaders.CONTENT_TYPE, DeployerApi.HEADER_CONTENT_TYPE_APPLICATION_JSON);
        return respond(status, json);
    }

    public Future<?> respond(HttpStatus status, @Nullable String body) {
        if (body == null) {
            body = "";
        }

        if (status != HttpStatus.OK) {
            log.warn("Responding with error. Method: {}. Path: {}. Status: {}. Body: {}", request.method(), request.path(), status,
                    body.length() > LOG_MAX_ERROR_LENGTH ? body.substring(0, LOG_MAX_ERROR_LENGTH) : body);
        }

        response.setStatusCode(status.getCode()).end(body);
        return Future.succeededFuture();
    }

    /**
     * Maps a service failure to a plain text response.
     */
    public Future<?> respond(Throwable error) {
        if (response.ended()) {
            return Future.succeededFuture();
        }

        if (response.headWritten()) {
            log.warn("Can't respond with error, response is already started. Path: {}", request.path(), error);
            response.end();
            return Future.succeededFuture();
        }

        if (error instanceof IllegalArgumentException) {
            return respond(HttpStatus.BAD_REQUEST, error.getMessage());
        }

        if (error instanceof HttpException exception) {
            return respond(exception.getStatus(), exception.getMessage());
        }

        log.error("Can't handle request. Method: {}. Path: {}", request.method(), request.path(), error);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, error.getMessage());
    }

    public ApiContext putHeader(CharSequence name, String value) {
        response.putHeader(name, value);
        return this;
    }

    @Nullable
    public String getQueryParam(String name) {
        return request.getParam(name);
    }

    public int getIntQueryParam(String name, int defaultValue) {
        String value = request.getParam(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid query parameter %s: %s".formatted(name, value));
        }
    }
}
