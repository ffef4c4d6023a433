package com.epam.aidial.deployer.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.experimental.Accessors;

@Data
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtifactRevision {
    String configSetId;
    String fileName;
    long revision;
    String content;
    long createdAt;

    public ArtifactFile toFile() {
        return new ArtifactFile(fileName, content, revision);
    }
}
