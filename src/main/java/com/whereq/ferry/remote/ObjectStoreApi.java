package com.whereq.ferry.remote;

import com.whereq.ferry.dto.StorageBucket;

/**
 * Cloud Storage operations used for source packages and logs
 */
public interface ObjectStoreApi {

    /**
     * Fetch the bucket, creating it in the project when it does not exist
     */
    RemoteRequest<StorageBucket> getOrCreateBucket(String bucket, String project);

    RemoteRequest<Boolean> blobExists(String bucket, String name);

    RemoteRequest<Void> upload(String bucket, String name, byte[] content, String contentType);

    RemoteRequest<Void> delete(String bucket, String name);
}
