package com.epam.aidial.deployer.service;

import com.epam.aidial.deployer.data.ArtifactFile;
import com.epam.aidial.deployer.data.ArtifactRevision;
import com.epam.aidial.deployer.data.ConfigSet;
import com.epam.aidial.deployer.storage.BlobStorage;
import com.epam.aidial.deployer.storage.BlobStorageUtil;
import com.epam.aidial.deployer.util.ArtifactConflictException;
import com.epam.aidial.deployer.util.JsonUtil;
import com.epam.aidial.deployer.util.ResourceNotFoundException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.LongSupplier;
import javax.annotation.Nullable;

/**
 * Versioned files of config sets. Every write appends a revision, history is never rewritten.
 * Writers of the same file are serialized, readers see the last committed head.
 */
@Slf4j
public class ArtifactStore {

    private static final String HEAD_FILE = "/head.json";
    private static final int MAX_FILE_NAME_LENGTH = 255;

    private final BlobStorage storage;
    private final LockService lockService;
    private final LongSupplier clock;
    private final long lockTimeout;

    public ArtifactStore(BlobStorage storage, LockService lockService, JsonObject settings, LongSupplier clock) {
        this.storage = storage;
        this.lockService = lockService;
        this.clock = clock;
        this.lockTimeout = settings.getLong("lockTimeout", 10_000L);
    }

    public ConfigSet register(ConfigSet configSet) {
        if (StringUtils.isBlank(configSet.getId())) {
            throw new IllegalArgumentException("Config set id must be provided");
        }

        String path = BlobStorageUtil.configSetPath(configSet.getId());
        return lockService.underLock(path, () -> {
            ConfigSet existing = getConfigSet(configSet.getId());
            configSet.setCreatedAt(existing == null ? clock.getAsLong() : existing.getCreatedAt());
            storage.store(path, JsonUtil.convertToString(configSet));
            log.info("Config set registered: {}", configSet.getId());
            return configSet;
        });
    }

    @Nullable
    public ConfigSet getConfigSet(String configSetId) {
        String json = storage.load(BlobStorageUtil.configSetPath(configSetId));
        return JsonUtil.convertToObject(json, ConfigSet.class);
    }

    public ConfigSet verifyConfigSet(String configSetId) {
        ConfigSet configSet = getConfigSet(configSetId);
        if (configSet == null) {
            throw new ResourceNotFoundException("Config set is not found: " + configSetId);
        }
        return configSet;
    }

    /**
     * @return head revisions of all files ordered by file name
     */
    public List<ArtifactFile> read(String configSetId) {
        verifyConfigSet(configSetId);
        List<ArtifactFile> files = new ArrayList<>();

        for (String path : storage.list(BlobStorageUtil.configSetFolder(configSetId) + "files/")) {
            if (!path.endsWith(HEAD_FILE)) {
                continue;
            }

            Head head = JsonUtil.convertToObject(storage.load(path), Head.class);
            if (head != null) {
                files.add(loadRevision(configSetId, head.fileName(), head.revision()).toFile());
            }
        }

        files.sort(Comparator.comparing(ArtifactFile::fileName));
        return files;
    }

    public ArtifactFile readFile(String configSetId, String fileName) {
        verifyConfigSet(configSetId);
        Head head = loadHead(configSetId, fileName);
        if (head == null) {
            throw new ResourceNotFoundException("File %s is not found in config set %s".formatted(fileName, configSetId));
        }
        return loadRevision(configSetId, fileName, head.revision()).toFile();
    }

    /**
     * @return all revisions of the file, oldest first
     */
    public List<ArtifactRevision> history(String configSetId, String fileName) {
        verifyConfigSet(configSetId);
        Head head = loadHead(configSetId, fileName);
        if (head == null) {
            throw new ResourceNotFoundException("File %s is not found in config set %s".formatted(fileName, configSetId));
        }

        List<ArtifactRevision> revisions = new ArrayList<>();
        for (long revision = 1; revision <= head.revision(); revision++) {
            revisions.add(loadRevision(configSetId, fileName, revision));
        }
        return revisions;
    }

    /**
     * Appends a new revision of the file.
     *
     * @param expectedRevision optional head revision the write is based on, 0 if the file must not exist yet
     * @return the committed revision with its content
     * @throws ArtifactConflictException if the expected revision is not the head or the file stays locked too long
     */
    public ArtifactRevision write(String configSetId, String fileName, String content, @Nullable Long expectedRevision) {
        verifyFile(fileName, content);
        verifyConfigSet(configSetId);

        String key = BlobStorageUtil.artifactHeadPath(configSetId, fileName);
        LockService.Lock lock = lockService.lock(key, lockTimeout);
        if (lock == null) {
            throw new ArtifactConflictException("File %s of config set %s is locked by another writer".formatted(fileName, configSetId));
        }

        try (lock) {
            Head head = loadHead(configSetId, fileName);
            long current = (head == null) ? 0 : head.revision();

            if (expectedRevision != null && expectedRevision != current) {
                throw new ArtifactConflictException("Revision %d of file %s is rejected, current revision is %d"
                        .formatted(expectedRevision, fileName, current));
            }

            ArtifactRevision revision = new ArtifactRevision()
                    .setConfigSetId(configSetId)
                    .setFileName(fileName)
                    .setRevision(current + 1)
                    .setContent(content)
                    .setCreatedAt(clock.getAsLong());

            storage.store(BlobStorageUtil.artifactRevisionPath(configSetId, fileName, revision.getRevision()), JsonUtil.convertToString(revision));
            storage.store(key, JsonUtil.convertToString(new Head(fileName, revision.getRevision())));

            log.debug("File {} of config set {} is written. Revision: {}", fileName, configSetId, revision.getRevision());
            return revision;
        }
    }

    @Nullable
    private Head loadHead(String configSetId, String fileName) {
        String json = storage.load(BlobStorageUtil.artifactHeadPath(configSetId, fileName));
        return JsonUtil.convertToObject(json, Head.class);
    }

    private ArtifactRevision loadRevision(String configSetId, String fileName, long revision) {
        String json = storage.load(BlobStorageUtil.artifactRevisionPath(configSetId, fileName, revision));
        ArtifactRevision result = JsonUtil.convertToObject(json, ArtifactRevision.class);
        if (result == null) {
            throw new IllegalStateException("Revision %d of file %s is missing in config set %s".formatted(revision, fileName, configSetId));
        }
        return result;
    }

    /**
     * @throws IllegalArgumentException if the file can't be written: blank or too long name, missing content
     */
    static void verifyFile(String fileName, String content) {
        if (StringUtils.isBlank(fileName)) {
            throw new IllegalArgumentException("File name must be provided");
        }

        if (fileName.length() > MAX_FILE_NAME_LENGTH) {
            throw new IllegalArgumentException("File name is too long: " + fileName.length());
        }

        if (content == null) {
            throw new IllegalArgumentException("Content of file %s must be provided".formatted(fileName));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Head(String fileName, long revision) {
    }
}
