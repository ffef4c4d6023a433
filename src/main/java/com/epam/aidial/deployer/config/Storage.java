package com.epam.aidial.deployer.config;

import lombok.Data;

import java.util.Properties;
import javax.annotation.Nullable;

@Data
public class Storage {
    /**
     * Specifies storage provider. Supported providers: filesystem, transient
     */
    String provider;
    /**
     * Optional. Specifies endpoint url for remote storages
     */
    @Nullable
    String endpoint;
    /**
     * Api key. Optional for filesystem and transient
     */
    @Nullable
    String identity;
    /**
     * Secret key. Optional for filesystem and transient
     */
    @Nullable
    String credential;
    /**
     * Container name/root bucket
     */
    String bucket;

    /**
     * Indicates whether bucket should be created on start up
     */
    boolean createBucket;

    /**
     * Optional. Collection of key-value pairs for overrides, for example: "jclouds.filesystem.basedir": "data"
     */
    @Nullable
    Properties overrides;

    /**
     * Optional. Name of the root folder in a bucket, base folder for all records. Must not contain path separators or any illegal chars
     */
    @Nullable
    String prefix;
}
