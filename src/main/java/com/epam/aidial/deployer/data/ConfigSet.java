package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.experimental.Accessors;

import java.util.Map;

/**
 * Bundle of generated deployment files, registered by the project analysis component.
 */
@Data
@Accessors(chain = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfigSet {
    String id;
    String projectId;
    String name;
    String version;
    /**
     * Local path of the analyzed source project.
     */
    String sourcePath;
    Map<String, String> vcs;
    Long createdAt;
}
