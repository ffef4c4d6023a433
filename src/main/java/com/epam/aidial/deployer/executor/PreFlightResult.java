package com.epam.aidial.deployer.executor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.stream.Collectors;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PreFlightResult(boolean passed, List<Check> checks) {

    public String describeFailures() {
        if (checks == null) {
            return "";
        }
        return checks.stream()
                .filter(check -> !check.passed())
                .map(check -> check.name() + ": " + check.message())
                .collect(Collectors.joining("; "));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Check(String name, boolean passed, String message) {
    }
}
