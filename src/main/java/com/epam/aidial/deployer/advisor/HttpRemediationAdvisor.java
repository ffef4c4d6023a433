package com.epam.aidial.deployer.advisor;

import com.epam.aidial.deployer.client.ServiceClient;
import com.epam.aidial.deployer.util.JsonUtil;
import com.epam.aidial.deployer.util.ServerSentEvent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A web client to the remediation agent. The agent streams {@code activity} events while it works
 * and finishes with one of {@code result}, {@code unfixable} or {@code error}.
 */
public class HttpRemediationAdvisor implements RemediationAdvisor {

    private final ServiceClient client;

    public HttpRemediationAdvisor(HttpClient client, JsonObject settings) {
        this.client = new ServiceClient(client, "remediation advisor",
                settings.getString("endpoint"), settings.getLong("idleTimeout", 300_000L));
    }

    @Override
    public boolean isAvailable() {
        return client.isActive();
    }

    @Override
    public CompletableFuture<RemediationProposal> propose(RemediationRequest request, Consumer<AdvisorActivity> activityListener) {
        return client.stream(HttpMethod.POST, "/v1/remediate", request, event -> switch (event.event()) {
            case "activity" -> {
                activityListener.accept(convert(event, AdvisorActivity.class));
                yield null;
            }
            case "result" -> {
                ResultResponse result = convert(event, ResultResponse.class);
                List<FileEdit> edits = (result.edits() == null) ? List.of() : result.edits();
                yield RemediationProposal.edits(edits, result.rationale(), result.agentState());
            }
            case "unfixable" -> RemediationProposal.unfixable(convert(event, UnfixableResponse.class).reason());
            case "error" -> throw new IllegalStateException("Advisor error: " + convert(event, ErrorResponse.class).message());
            default -> throw new IllegalStateException("Invalid response. Invalid event: " + event.event());
        });
    }

    private static <T> T convert(ServerSentEvent event, Class<T> clazz) {
        T value = JsonUtil.convertToObject(event.data(), clazz);
        if (value == null) {
            throw new IllegalStateException("Invalid response. No data in event: " + event.event());
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ResultResponse(List<FileEdit> edits, String rationale, String agentState) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record UnfixableResponse(String reason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ErrorResponse(String message) {
    }
}
