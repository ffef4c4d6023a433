package com.epam.aidial.deployer.client;

import com.epam.aidial.deployer.util.EventStreamParser;
import com.epam.aidial.deployer.util.JsonUtil;
import com.epam.aidial.deployer.util.ServerSentEvent;
import com.epam.aidial.deployer.util.ServiceUnavailableException;
import io.vertx.core.Future;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.parsetools.RecordParser;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/**
 * A web client to a collaborating service which answers with JSON documents or with server-sent event streams.
 * Cancelling a returned future resets the underlying request.
 */
@Slf4j
public class ServiceClient {

    private static final String CONTENT_TYPE_APPLICATION_JSON = "application/json";
    private static final String CONTENT_TYPE_EVENT_STREAM = "text/event-stream";

    private final HttpClient client;
    private final String name;
    @Getter
    @Nullable
    private final String endpoint;
    private final long idleTimeout;

    public ServiceClient(HttpClient client, String name, @Nullable String endpoint, long idleTimeout) {
        this.client = client;
        this.name = name;
        this.endpoint = endpoint;
        this.idleTimeout = idleTimeout;
    }

    public boolean isActive() {
        return endpoint != null;
    }

    public void verifyActive() {
        if (!isActive()) {
            throw new ServiceUnavailableException("The %s is not available".formatted(name));
        }
    }

    /**
     * Sends a request and converts the JSON response.
     *
     * @param clazz expected type of the response, {@link Void} to ignore the body
     */
    public <R> CompletableFuture<R> call(HttpMethod method, String path, @Nullable Object body, Class<R> clazz) {
        verifyActive();

        CompletableFuture<R> result = new CompletableFuture<>();
        AtomicReference<HttpClientRequest> requestReference = new AtomicReference<>();
        resetOnCancel(result, requestReference);

        send(method, path, body, CONTENT_TYPE_APPLICATION_JSON, requestReference)
                .compose(response -> response.body().map(buffer -> {
                    String text = buffer.toString(StandardCharsets.UTF_8);
                    if (response.statusCode() != 200) {
                        throw new IllegalStateException("%s API error. Code: %d. Body: %s".formatted(name, response.statusCode(), text));
                    }
                    return text;
                }))
                .map(text -> (clazz == Void.class) ? null : JsonUtil.convertToObject(text, clazz))
                .onSuccess(result::complete)
                .onFailure(result::completeExceptionally);

        return result;
    }

    /**
     * Sends a request and feeds the event stream of the response to the handler.
     * The call completes with the first non-null value returned by the handler.
     */
    public <R> CompletableFuture<R> stream(HttpMethod method, String path, @Nullable Object body, EventHandler<R> handler) {
        verifyActive();

        CompletableFuture<R> result = new CompletableFuture<>();
        AtomicReference<HttpClientRequest> requestReference = new AtomicReference<>();
        resetOnCancel(result, requestReference);

        send(method, path, body, CONTENT_TYPE_EVENT_STREAM, requestReference)
                .onSuccess(response -> {
                    if (response.statusCode() != 200) {
                        response.body().onComplete(ignore -> result.completeExceptionally(
                                new IllegalStateException("%s API error. Code: %d".formatted(name, response.statusCode()))));
                        return;
                    }

                    EventStreamParser parser = new EventStreamParser(event -> handle(event, handler, result));
                    RecordParser.newDelimited("\n", response)
                            .exceptionHandler(result::completeExceptionally)
                            .endHandler(ignore -> {
                                parser.flush();
                                result.completeExceptionally(new IllegalStateException("Invalid response. Unexpected end of stream"));
                            })
                            .handler(line -> parser.onLine(line.toString(StandardCharsets.UTF_8)));
                })
                .onFailure(result::completeExceptionally);

        return result;
    }

    private Future<HttpClientResponse> send(HttpMethod method, String path, @Nullable Object body, String accept,
                                            AtomicReference<HttpClientRequest> requestReference) {
        RequestOptions requestOptions = new RequestOptions()
                .setMethod(method)
                .setAbsoluteURI(endpoint + path)
                .setIdleTimeout(idleTimeout);

        return client.request(requestOptions)
                .compose(request -> {
                    requestReference.set(request);
                    request.putHeader(HttpHeaders.ACCEPT, accept);

                    if (body == null) {
                        return request.send();
                    }

                    request.putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_APPLICATION_JSON);
                    return request.send(JsonUtil.convertToString(body));
                });
    }

    private static <R> void handle(ServerSentEvent event, EventHandler<R> handler, CompletableFuture<R> result) {
        if (result.isDone()) {
            return;
        }

        try {
            R value = handler.onEvent(event);
            if (value != null) {
                result.complete(value);
            }
        } catch (Throwable e) {
            result.completeExceptionally(e);
        }
    }

    private void resetOnCancel(CompletableFuture<?> result, AtomicReference<HttpClientRequest> requestReference) {
        result.whenComplete((value, error) -> {
            HttpClientRequest request = requestReference.get();
            if (result.isCancelled() && request != null) {
                log.warn("Resetting {} request to {}", name, request.path());
                request.reset();
            }
        });
    }

    @FunctionalInterface
    public interface EventHandler<R> {
        /**
         * @return the final result or null to continue reading the stream
         */
        @Nullable
        R onEvent(ServerSentEvent event) throws Exception;
    }
}
