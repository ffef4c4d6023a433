package com.epam.aidial.deployer.executor;

import com.epam.aidial.deployer.data.PortMapping;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Outcome of a deploy.
 *
 * @param resourceFault the failure can't be fixed by editing artifacts, for example no free ports are left
 */
public record DeployResult(boolean success,
                           String logs,
                           @Nullable String containerId,
                           List<PortMapping> ports,
                           @Nullable String url,
                           boolean resourceFault,
                           @Nullable String error) {

    public static DeployResult success(String logs, String containerId, List<PortMapping> ports, String url) {
        return new DeployResult(true, logs, containerId, ports, url, false, null);
    }

    public static DeployResult failure(String logs, String error, boolean resourceFault) {
        return new DeployResult(false, logs, null, List.of(), null, resourceFault, error);
    }
}
