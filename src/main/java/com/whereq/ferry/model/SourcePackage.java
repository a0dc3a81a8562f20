package com.whereq.ferry.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * Content addressed archive of the working directory
 */
@Value
public class SourcePackage {
    /**
     * sha256 of the archive bytes
     */
    String hash;

    /**
     * Archive in the local cache directory
     */
    Path localPath;

    /**
     * Object name inside the bucket
     */
    String blobName;
}
