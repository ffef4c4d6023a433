package com.epam.aidial.deployer.util;

public record ServerSentEvent(String event, String data) {
}
