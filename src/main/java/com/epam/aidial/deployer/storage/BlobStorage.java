package com.epam.aidial.deployer.storage;

import com.epam.aidial.deployer.config.Storage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jclouds.ContextBuilder;
import org.jclouds.blobstore.BlobStore;
import org.jclouds.blobstore.BlobStoreContext;
import org.jclouds.blobstore.domain.Blob;
import org.jclouds.blobstore.domain.PageSet;
import org.jclouds.blobstore.domain.StorageMetadata;
import org.jclouds.blobstore.domain.StorageType;
import org.jclouds.blobstore.options.ListContainerOptions;
import org.jclouds.io.payloads.ByteArrayPayload;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import javax.annotation.Nullable;

@Slf4j
public class BlobStorage implements Closeable {

    private static final String JSON_CONTENT_TYPE = "application/json";

    private final BlobStoreContext storeContext;
    private final BlobStore blobStore;
    private final String bucketName;

    // defines a root folder for all records in bucket
    @Getter
    @Nullable
    private final String prefix;

    public BlobStorage(Storage config) {
        ContextBuilder builder = ContextBuilder.newBuilder(config.getProvider());
        if (config.getEndpoint() != null) {
            builder.endpoint(config.getEndpoint());
        }
        Properties overrides = config.getOverrides();
        if (overrides != null) {
            builder.overrides(overrides);
        }
        if (config.getIdentity() != null) {
            builder.credentials(config.getIdentity(), config.getCredential());
        }
        this.storeContext = builder.buildView(BlobStoreContext.class);
        this.blobStore = storeContext.getBlobStore();
        this.bucketName = config.getBucket();
        this.prefix = config.getPrefix();
        createBucketIfNeeded(config);
    }

    /**
     * Upload a JSON document in a single request
     *
     * @param absoluteFilePath absolute path according to the bucket, for example: deployments/1/deployment.json
     * @param json             whole document
     */
    public void store(String absoluteFilePath, String json) {
        byte[] data = json.getBytes(StandardCharsets.UTF_8);
        String storageLocation = getStorageLocation(absoluteFilePath);
        Blob blob = blobStore.blobBuilder(storageLocation)
                .payload(new ByteArrayPayload(data))
                .contentLength(data.length)
                .contentType(JSON_CONTENT_TYPE)
                .build();

        blobStore.putBlob(bucketName, blob);
    }

    /**
     * Load document content from blob store
     *
     * @param filePath absolute file path, for example: deployments/1/deployment.json
     * @return the content if the document was found, null - otherwise
     */
    @Nullable
    public String load(String filePath) {
        String storageLocation = getStorageLocation(filePath);
        Blob blob = blobStore.getBlob(bucketName, storageLocation);
        if (blob == null) {
            return null;
        }

        try (InputStream stream = blob.getPayload().openStream()) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read blob: " + filePath, e);
        }
    }

    public boolean exists(String filePath) {
        String storageLocation = getStorageLocation(filePath);
        return blobStore.blobExists(bucketName, storageLocation);
    }

    public void delete(String filePath) {
        String storageLocation = getStorageLocation(filePath);
        blobStore.removeBlob(bucketName, storageLocation);
    }

    /**
     * Lists documents under the folder recursively.
     *
     * @param folderPath absolute folder path ending with a separator, for example: deployments/
     * @return absolute paths of the documents
     */
    public List<String> list(String folderPath) {
        List<String> paths = new ArrayList<>();
        String marker = null;

        do {
            ListContainerOptions options = new ListContainerOptions()
                    .prefix(getStorageLocation(folderPath))
                    .recursive();
            if (marker != null) {
                options.afterMarker(marker);
            }

            PageSet<? extends StorageMetadata> page = blobStore.list(bucketName, options);
            for (StorageMetadata metadata : page) {
                if (metadata.getType() == StorageType.BLOB) {
                    paths.add(removePrefix(metadata.getName()));
                }
            }
            marker = page.getNextMarker();
        } while (marker != null);

        return paths;
    }

    public void deleteFolder(String folderPath) {
        for (String path : list(folderPath)) {
            delete(path);
        }
    }

    private String removePrefix(String path) {
        if (prefix == null) {
            return path;
        }
        return path.substring(prefix.length() + 1);
    }

    @Override
    public void close() {
        storeContext.close();
    }

    private void createBucketIfNeeded(Storage config) {
        if (config.isCreateBucket() && !storeContext.getBlobStore().containerExists(bucketName)) {
            storeContext.getBlobStore().createContainerInLocation(null, bucketName);
        }
    }

    private String getStorageLocation(String absoluteFilePath) {
        return BlobStorageUtil.toStoragePath(prefix, absoluteFilePath);
    }
}
