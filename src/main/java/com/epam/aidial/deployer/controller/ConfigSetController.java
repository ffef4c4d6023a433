package com.epam.aidial.deployer.controller;

import com.epam.aidial.deployer.ApiContext;
import com.epam.aidial.deployer.DeployerApi;
import com.epam.aidial.deployer.data.ArtifactRevision;
import com.epam.aidial.deployer.data.ConfigSet;
import com.epam.aidial.deployer.data.ListResponse;
import com.epam.aidial.deployer.service.ArtifactStore;
import com.epam.aidial.deployer.util.ArtifactConflictException;
import com.epam.aidial.deployer.util.HttpException;
import com.epam.aidial.deployer.util.HttpStatus;
import com.epam.aidial.deployer.util.JsonUtil;
import com.epam.aidial.deployer.util.RevisionHeader;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Config set registration and artifact files. A file is addressed by its name, its entity tag is the head revision.
 */
@Slf4j
public class ConfigSetController {

    private final ApiContext context;
    private final Vertx vertx;
    private final ArtifactStore artifactStore;

    public ConfigSetController(DeployerApi api, ApiContext context) {
        this.context = context;
        this.vertx = api.getVertx();
        this.artifactStore = api.getArtifactStore();
    }

    public Future<?> putConfigSet(String configSetId) {
        context.getRequest()
                .body()
                .compose(buffer -> {
                    ConfigSet configSet;
                    try {
                        configSet = JsonUtil.convertToObject(buffer, ConfigSet.class);
                    } catch (Exception e) {
                        log.error("Invalid request body provided", e);
                        throw new IllegalArgumentException("Can't register config set. Incorrect body provided");
                    }

                    if (configSet == null) {
                        throw new IllegalArgumentException("Can't register config set. Body must be provided");
                    }

                    if (configSet.getId() != null && !configSet.getId().equals(configSetId)) {
                        throw new IllegalArgumentException("Config set id in body does not match the path: " + configSet.getId());
                    }

                    configSet.setId(configSetId);
                    return vertx.executeBlocking(() -> artifactStore.register(configSet), false);
                })
                .onSuccess(configSet -> context.respond(HttpStatus.OK, configSet))
                .onFailure(context::respond);

        return Future.succeededFuture();
    }

    public Future<?> getConfigSet(String configSetId) {
        vertx.executeBlocking(() -> artifactStore.verifyConfigSet(configSetId), false)
                .onSuccess(configSet -> context.respond(HttpStatus.OK, configSet))
                .onFailure(context::respond);

        return Future.succeededFuture();
    }

    public Future<?> getFiles(String configSetId) {
        vertx.executeBlocking(() -> artifactStore.read(configSetId), false)
                .onSuccess(files -> context.respond(HttpStatus.OK, new ListResponse<>(files, files.size())))
                .onFailure(context::respond);

        return Future.succeededFuture();
    }

    public Future<?> getFile(String configSetId, String fileName) {
        vertx.executeBlocking(() -> artifactStore.readFile(configSetId, fileName), false)
                .onSuccess(file -> context.putHeader(HttpHeaders.ETAG, RevisionHeader.toEtag(file.revision()))
                        .respond(HttpStatus.OK, file))
                .onFailure(context::respond);

        return Future.succeededFuture();
    }

    public Future<?> getRevisions(String configSetId, String fileName) {
        vertx.executeBlocking(() -> artifactStore.history(configSetId, fileName), false)
                .onSuccess(revisions -> context.respond(HttpStatus.OK, new ListResponse<>(revisions, revisions.size())))
                .onFailure(context::respond);

        return Future.succeededFuture();
    }

    /**
     * Writes the raw request body as the new head of the file.
     */
    public Future<?> putFile(String configSetId, String fileName) {
        RevisionHeader revisionHeader = RevisionHeader.fromRequest(context.getRequest());

        context.getRequest()
                .body()
                .compose(buffer -> {
                    String content = buffer.toString(StandardCharsets.UTF_8);
                    return vertx.executeBlocking(() -> write(configSetId, fileName, content, revisionHeader), false);
                })
                .onSuccess(revision -> context.putHeader(HttpHeaders.ETAG, RevisionHeader.toEtag(revision.getRevision()))
                        .respond(HttpStatus.OK, revision.toFile()))
                .onFailure(context::respond);

        return Future.succeededFuture();
    }

    private ArtifactRevision write(String configSetId, String fileName, String content, RevisionHeader revisionHeader) {
        Long expectedRevision = revisionHeader.expectedRevision();
        try {
            return artifactStore.write(configSetId, fileName, content, expectedRevision);
        } catch (ArtifactConflictException e) {
            if (expectedRevision == null) {
                throw e;
            }
            throw new HttpException(HttpStatus.PRECONDITION_FAILED, e.getMessage());
        }
    }
}
