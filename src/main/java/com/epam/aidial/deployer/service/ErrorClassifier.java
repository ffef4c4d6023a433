package com.epam.aidial.deployer.service;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes well-known failures in build and container output.
 */
@UtilityClass
public class ErrorClassifier {

    private static final int MAX_MESSAGE_LENGTH = 200;

    private static final List<Rule> RULES = List.of(
            new Rule(Kind.DOCKERFILE_INVALID, "failed to solve:.*dockerfile parse error"),
            new Rule(Kind.DEPENDENCY_MISSING, "npm ERR!.*(ENOENT|ERESOLVE|code E404)"),
            new Rule(Kind.COMPOSE_INVALID, "yaml:\\s*(line\\s+\\d+:|.*did not find expected)|services\\.[^:]+:\\s+Additional property.*not allowed"),
            new Rule(Kind.IMAGE_NOT_FOUND, "manifest.*not found|image.*not found|pull access denied|failed to pull"),
            new Rule(Kind.PORT_CONFLICT, "bind:.*address already in use|port.*already allocated"),
            new Rule(Kind.DISK_FULL, "no space left on device|disk.*full"),
            new Rule(Kind.MEMORY_EXCEEDED, "\\bOOM\\b|out of memory|memory.*exceeded"),
            new Rule(Kind.PERMISSION_DENIED, "permission denied|EACCES|access denied"),
            new Rule(Kind.NETWORK_ERROR, "network.*unreachable|ECONNREFUSED|ETIMEDOUT"),
            new Rule(Kind.ENV_VAR_MISSING, "environment variable.*not set|missing.*env|undefined.*variable"),
            new Rule(Kind.HEALTHCHECK_FAILED, "health.*check.*fail|unhealthy"),
            new Rule(Kind.STARTUP_FAILED, "exited with code [1-9]|failed to start"),
            new Rule(Kind.BUILD_FAILED, "failed to solve:.*did not complete successfully")
    );

    private static final List<Pattern> ERROR_LINES = List.of(
            Pattern.compile("^>?\\s*(?:\\[\\d+/\\d+]\\s+)?(?:ERROR|Error|error)[\\s:]+(.+)"),
            Pattern.compile("^>?\\s*(?:FAILED|Failed|failed)[\\s:]+(.+)"),
            Pattern.compile("^>?\\s*(?:FATAL|Fatal|fatal)[\\s:]+(.+)"),
            Pattern.compile("^>?\\s*npm ERR!\\s*(.+)")
    );

    private static final Pattern NOISE = Pattern.compile("easier to read|for more information|learn how to|visit https?:|docker scan",
            Pattern.CASE_INSENSITIVE);

    public Classification classify(String logs) {
        String text = StringUtils.defaultString(logs);
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(text).find()) {
                return new Classification(rule.kind(), summarize(text));
            }
        }
        return new Classification(Kind.UNKNOWN, summarize(text));
    }

    /**
     * @return the first meaningful error line or the last line of the output
     */
    public String summarize(String logs) {
        String[] lines = StringUtils.defaultString(logs).split("\n");

        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || NOISE.matcher(line).find()) {
                continue;
            }

            for (Pattern pattern : ERROR_LINES) {
                Matcher matcher = pattern.matcher(line);
                if (matcher.find() && matcher.group(1).trim().length() > 5) {
                    return StringUtils.abbreviate(matcher.group(1).trim(), MAX_MESSAGE_LENGTH);
                }
            }
        }

        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].trim();
            if (!line.isEmpty()) {
                return StringUtils.abbreviate(line, MAX_MESSAGE_LENGTH);
            }
        }

        return "No output";
    }

    public enum Kind {
        DOCKERFILE_INVALID,
        BUILD_FAILED,
        DEPENDENCY_MISSING,
        COMPOSE_INVALID,
        IMAGE_NOT_FOUND,
        PORT_CONFLICT,
        DISK_FULL,
        MEMORY_EXCEEDED,
        PERMISSION_DENIED,
        NETWORK_ERROR,
        ENV_VAR_MISSING,
        HEALTHCHECK_FAILED,
        STARTUP_FAILED,
        UNKNOWN;

        /**
         * Faults of the host, editing artifacts can't fix them.
         */
        public boolean isResourceFault() {
            return this == PORT_CONFLICT || this == DISK_FULL;
        }
    }

    public record Classification(Kind kind, String message) {
    }

    private record Rule(Kind kind, Pattern pattern) {
        Rule(Kind kind, String regex) {
            this(kind, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
    }
}
