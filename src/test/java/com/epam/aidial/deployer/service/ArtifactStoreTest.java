package com.epam.aidial.deployer.service;

import com.epam.aidial.deployer.TestStorage;
import com.epam.aidial.deployer.data.ArtifactFile;
import com.epam.aidial.deployer.data.ArtifactRevision;
import com.epam.aidial.deployer.data.ConfigSet;
import com.epam.aidial.deployer.storage.BlobStorage;
import com.epam.aidial.deployer.storage.BlobStorageUtil;
import com.epam.aidial.deployer.util.ArtifactConflictException;
import com.epam.aidial.deployer.util.ResourceNotFoundException;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArtifactStoreTest {

    private BlobStorage storage;
    private LockService lockService;
    private ArtifactStore store;
    private long time = 1000;

    @BeforeEach
    void init() {
        storage = TestStorage.transientStorage();
        lockService = new LockService();
        store = new ArtifactStore(storage, lockService, new JsonObject().put("lockTimeout", 100), () -> time);
        store.register(new ConfigSet().setId("cs1").setProjectId("p1").setName("app"));
    }

    @AfterEach
    void destroy() {
        storage.close();
    }

    @Test
    void testRegister() {
        ConfigSet configSet = store.verifyConfigSet("cs1");
        assertEquals("p1", configSet.getProjectId());
        assertEquals(1000, configSet.getCreatedAt());

        time = 2000;
        store.register(new ConfigSet().setId("cs1").setProjectId("p1").setName("renamed"));
        configSet = store.verifyConfigSet("cs1");
        assertEquals("renamed", configSet.getName());
        assertEquals(1000, configSet.getCreatedAt());

        assertThrows(ResourceNotFoundException.class, () -> store.verifyConfigSet("missing"));
        assertThrows(IllegalArgumentException.class, () -> store.register(new ConfigSet()));
    }

    @Test
    void testWriteAppendsRevisions() {
        ArtifactRevision first = store.write("cs1", "Dockerfile", "FROM node:18", null);
        assertEquals(1, first.getRevision());

        time = 2000;
        ArtifactRevision second = store.write("cs1", "Dockerfile", "FROM node:20", 1L);
        assertEquals(2, second.getRevision());
        assertEquals(2000, second.getCreatedAt());

        assertEquals(new ArtifactFile("Dockerfile", "FROM node:20", 2), store.readFile("cs1", "Dockerfile"));

        List<ArtifactRevision> history = store.history("cs1", "Dockerfile");
        assertEquals(2, history.size());
        assertEquals("FROM node:18", history.get(0).getContent());
        assertEquals("FROM node:20", history.get(1).getContent());
    }

    @Test
    void testReadReturnsHeadsSortedByName() {
        store.write("cs1", "docker-compose.yml", "services: {}", null);
        store.write("cs1", "Dockerfile", "FROM node:18", null);
        store.write("cs1", "k8s/deployment.yaml", "kind: Deployment", null);
        store.write("cs1", "Dockerfile", "FROM node:20", null);

        List<ArtifactFile> files = store.read("cs1");
        assertEquals(List.of(
                new ArtifactFile("Dockerfile", "FROM node:20", 2),
                new ArtifactFile("docker-compose.yml", "services: {}", 1),
                new ArtifactFile("k8s/deployment.yaml", "kind: Deployment", 1)), files);
    }

    @Test
    void testStaleRevisionIsRejected() {
        store.write("cs1", "Dockerfile", "v1", null);
        store.write("cs1", "Dockerfile", "v2", 1L);

        assertThrows(ArtifactConflictException.class, () -> store.write("cs1", "Dockerfile", "v3", 1L));
        assertThrows(ArtifactConflictException.class, () -> store.write("cs1", "Dockerfile", "v3", 0L));
        assertThrows(ArtifactConflictException.class, () -> store.write("cs1", "new.txt", "x", 1L));
        assertEquals("v2", store.readFile("cs1", "Dockerfile").content());

        assertEquals(1, store.write("cs1", "new.txt", "x", 0L).getRevision());
    }

    @Test
    void testLockedFileTimesOut() {
        try (LockService.Lock ignored = lockService.lock(BlobStorageUtil.artifactHeadPath("cs1", "Dockerfile"))) {
            assertThrows(ArtifactConflictException.class, () -> store.write("cs1", "Dockerfile", "v1", null));
        }

        assertEquals(1, store.write("cs1", "Dockerfile", "v1", null).getRevision());
    }

    @Test
    void testMissingResources() {
        assertThrows(ResourceNotFoundException.class, () -> store.readFile("cs1", "Dockerfile"));
        assertThrows(ResourceNotFoundException.class, () -> store.history("cs1", "Dockerfile"));
        assertThrows(ResourceNotFoundException.class, () -> store.read("missing"));
        assertThrows(ResourceNotFoundException.class, () -> store.write("missing", "Dockerfile", "x", null));
        assertThrows(IllegalArgumentException.class, () -> store.write("cs1", " ", "x", null));
        assertThrows(IllegalArgumentException.class, () -> store.write("cs1", "a".repeat(256), "x", null));
        assertThrows(IllegalArgumentException.class, () -> store.write("cs1", "Dockerfile", null, null));
    }

    @Test
    void testConcurrentWritersGetDistinctRevisions() throws Exception {
        ArtifactStore store = new ArtifactStore(storage, lockService, new JsonObject(), () -> time);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<Long>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < 4; i++) {
                String content = "writer " + i;
                futures.add(CompletableFuture.supplyAsync(() -> {
                    awaitQuietly(start);
                    return store.write("cs1", "Dockerfile", content, null).getRevision();
                }, executor));
            }

            start.countDown();
            List<Long> revisions = new ArrayList<>();
            for (CompletableFuture<Long> future : futures) {
                revisions.add(future.get(30, TimeUnit.SECONDS));
            }

            revisions.sort(Long::compare);
            assertEquals(List.of(1L, 2L, 3L, 4L), revisions);
            assertEquals(4, store.history("cs1", "Dockerfile").size());
            assertTrue(store.readFile("cs1", "Dockerfile").content().startsWith("writer "));
        } finally {
            executor.shutdownNow();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
