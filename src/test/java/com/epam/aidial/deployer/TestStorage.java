package com.epam.aidial.deployer;

import com.epam.aidial.deployer.config.Storage;
import com.epam.aidial.deployer.storage.BlobStorage;
import lombok.experimental.UtilityClass;

import java.util.UUID;
import javax.annotation.Nullable;

@UtilityClass
public class TestStorage {

    /**
     * @return in-memory storage with a fresh bucket
     */
    public static BlobStorage transientStorage() {
        return transientStorage(null);
    }

    public static BlobStorage transientStorage(@Nullable String prefix) {
        Storage config = new Storage();
        config.setProvider("transient");
        config.setBucket("test-" + UUID.randomUUID());
        config.setCreateBucket(true);
        config.setPrefix(prefix);
        return new BlobStorage(config);
    }
}
