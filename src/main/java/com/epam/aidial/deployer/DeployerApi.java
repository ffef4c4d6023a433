package com.epam.aidial.deployer;

import com.epam.aidial.deployer.controller.Controller;
import com.epam.aidial.deployer.controller.ControllerSelector;
import com.epam.aidial.deployer.service.ArtifactStore;
import com.epam.aidial.deployer.service.DeploymentOrchestrator;
import com.epam.aidial.deployer.service.ProgressBroadcaster;
import com.epam.aidial.deployer.util.HttpException;
import com.epam.aidial.deployer.util.HttpStatus;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.http.HttpVersion;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

@Slf4j
@Getter
@RequiredArgsConstructor
public class DeployerApi implements Handler<HttpServerRequest> {

    public static final String HEALTH_CHECK_PATH = "/health";
    public static final String VERSION_PATH = "/version";
    public static final String HEADER_CONTENT_TYPE_APPLICATION_JSON = "application/json";

    public static final int REQUEST_BODY_MAX_SIZE_BYTES = 16 * 1024 * 1024;

    private static final Set<HttpMethod> ALLOWED_HTTP_METHODS = Set.of(HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE);

    private final Vertx vertx;
    private final DeploymentOrchestrator orchestrator;
    private final ArtifactStore artifactStore;
    private final ProgressBroadcaster broadcaster;
    private final String version;

    @Override
    public void handle(HttpServerRequest request) {
        try {
            handleRequest(request);
        } catch (Throwable e) {
            handleError(e, request);
        }
    }

    private void handleError(Throwable error, HttpServerRequest request) {
        if (!request.response().ended()) {
            HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
            String message = null;

            if (error instanceof HttpException e) {
                status = e.getStatus();
                message = e.getMessage();
            } else if (error instanceof IllegalArgumentException e) {
                status = HttpStatus.BAD_REQUEST;
                message = e.getMessage();
            } else {
                log.error("Can't handle request", error);
            }

            respond(request, status, message);
        }
    }

    private void handleRequest(HttpServerRequest request) {
        enableCors(request);

        if (request.version() != HttpVersion.HTTP_1_1) {
            respond(request, HttpStatus.HTTP_VERSION_NOT_SUPPORTED);
            return;
        }

        HttpMethod requestMethod = request.method();
        if (requestMethod == HttpMethod.OPTIONS) {
            // Allow OPTIONS request caching by browser
            request.response().putHeader(HttpHeaders.ACCESS_CONTROL_MAX_AGE, "86400");
            respond(request, HttpStatus.OK);
            return;
        }

        if (!ALLOWED_HTTP_METHODS.contains(requestMethod)) {
            respond(request, HttpStatus.METHOD_NOT_ALLOWED);
            return;
        }

        // Content-Length can be missing when Transfer-Encoding: chunked
        if (contentLength(request) > REQUEST_BODY_MAX_SIZE_BYTES) {
            respond(request, HttpStatus.REQUEST_ENTITY_TOO_LARGE, "Request body is too large");
            return;
        }

        String path = request.path();
        if (request.method() == HttpMethod.GET && path.equals(HEALTH_CHECK_PATH)) {
            respond(request, HttpStatus.OK);
            return;
        }

        if (request.method() == HttpMethod.GET && path.equals(VERSION_PATH)) {
            respond(request, HttpStatus.OK, version);
            return;
        }

        request.pause();
        handleApiRequest(request)
                .onFailure(error -> handleError(error, request))
                .onComplete(ignore -> request.resume());
    }

    private Future<?> handleApiRequest(HttpServerRequest request) {
        Future<?> future;
        try {
            ApiContext context = new ApiContext(request);
            Controller controller = ControllerSelector.select(this, context);
            future = controller.handle();
        } catch (Exception e) {
            future = Future.failedFuture(e);
        }
        return future;
    }

    private static void enableCors(HttpServerRequest request) {
        HttpServerResponse response = request.response();
        response.putHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");

        String requestMethod = request.getHeader(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD);
        if (requestMethod != null) {
            response.putHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, requestMethod);
        }
        String requestHeaders = request.getHeader(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS);
        if (requestHeaders != null) {
            response.putHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, requestHeaders);
        }
        response.putHeader(HttpHeaders.ACCESS_CONTROL_EXPOSE_HEADERS, HttpHeaders.ETAG);
    }

    private static long contentLength(HttpServerRequest request) {
        String value = request.getHeader(HttpHeaders.CONTENT_LENGTH);
        if (value == null) {
            return 0;
        }

        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw new HttpException(HttpStatus.BAD_REQUEST, "Invalid Content-Length: " + value);
        }
    }

    private void respond(HttpServerRequest request, HttpStatus status) {
        respond(request, status, null);
    }

    private void respond(HttpServerRequest request, HttpStatus status, String body) {
        request.response().setStatusCode(status.getCode()).end(body == null ? "" : body);
    }
}
