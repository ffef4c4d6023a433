package com.epam.aidial.deployer.data;

public record PortMapping(int host, int container, String protocol) {
}
