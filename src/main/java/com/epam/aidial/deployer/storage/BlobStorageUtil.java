package com.epam.aidial.deployer.storage;

import com.epam.aidial.deployer.util.UrlUtil;
import lombok.experimental.UtilityClass;

import javax.annotation.Nullable;

@UtilityClass
public class BlobStorageUtil {

    public static final String PATH_SEPARATOR = "/";

    public static final String DEPLOYMENTS_LOCATION = "deployments/";
    public static final String CONFIG_SETS_LOCATION = "configsets/";

    public String toStoragePath(@Nullable String prefix, String absoluteResourcePath) {
        if (prefix == null) {
            return absoluteResourcePath;
        }

        return prefix + PATH_SEPARATOR + absoluteResourcePath;
    }

    public String deploymentFolder(String deploymentId) {
        return DEPLOYMENTS_LOCATION + UrlUtil.encodePathSegment(deploymentId) + PATH_SEPARATOR;
    }

    public String deploymentPath(String deploymentId) {
        return deploymentFolder(deploymentId) + "deployment.json";
    }

    public String sessionFolder(String deploymentId) {
        return deploymentFolder(deploymentId) + "sessions/";
    }

    public String sessionPath(String deploymentId, String sessionId) {
        return sessionFolder(deploymentId) + UrlUtil.encodePathSegment(sessionId) + ".json";
    }

    public String configSetFolder(String configSetId) {
        return CONFIG_SETS_LOCATION + UrlUtil.encodePathSegment(configSetId) + PATH_SEPARATOR;
    }

    public String configSetPath(String configSetId) {
        return configSetFolder(configSetId) + "configset.json";
    }

    public String artifactFolder(String configSetId, String fileName) {
        return configSetFolder(configSetId) + "files/" + UrlUtil.encodePathSegment(fileName) + PATH_SEPARATOR;
    }

    /**
     * Head pointer of a file. Written last, after the revision it points to is stored.
     */
    public String artifactHeadPath(String configSetId, String fileName) {
        return artifactFolder(configSetId, fileName) + "head.json";
    }

    public String artifactRevisionPath(String configSetId, String fileName, long revision) {
        return artifactFolder(configSetId, fileName) + "revisions/%010d.json".formatted(revision);
    }
}
