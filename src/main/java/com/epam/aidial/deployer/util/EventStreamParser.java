package com.epam.aidial.deployer.util;

import org.apache.commons.lang3.StringUtils;

import java.util.function.Consumer;

/**
 * Incremental parser of a {@code text/event-stream} body fed line by line.
 * Only {@code event} and {@code data} fields are recognized, comments are skipped.
 */
public class EventStreamParser {

    private static final String DEFAULT_EVENT = "message";

    private final Consumer<ServerSentEvent> consumer;
    private final StringBuilder data = new StringBuilder();
    private String event;
    private boolean hasData;

    public EventStreamParser(Consumer<ServerSentEvent> consumer) {
        this.consumer = consumer;
    }

    public void onLine(String rawLine) {
        String line = StringUtils.removeEnd(rawLine, "\r");
        if (line.isEmpty()) {
            dispatch();
            return;
        }

        if (line.startsWith(":")) {
            return; // comment or heartbeat
        }

        int colon = line.indexOf(':');
        String field = (colon < 0) ? line : line.substring(0, colon);
        String value = (colon < 0) ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }

        switch (field) {
            case "event" -> event = value;
            case "data" -> {
                if (hasData) {
                    data.append('\n');
                }
                data.append(value);
                hasData = true;
            }
            default -> {
                // id and retry are not used
            }
        }
    }

    /**
     * Dispatches a pending event when the stream ends without a trailing blank line.
     */
    public void flush() {
        dispatch();
    }

    private void dispatch() {
        if (event == null && !hasData) {
            return;
        }

        ServerSentEvent sse = new ServerSentEvent((event == null) ? DEFAULT_EVENT : event, data.toString());
        event = null;
        hasData = false;
        data.setLength(0);
        consumer.accept(sse);
    }
}
