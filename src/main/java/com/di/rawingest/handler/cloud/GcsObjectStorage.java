package com.di.rawingest.handler.cloud;

import com.di.rawingest.handler.ObjectStorage;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * {@link ObjectStorage} for {@code gs://} URIs, backed by the Cloud Storage client.
 * The client is resolved lazily on the first lookup.
 */
@Component
@Slf4j
public class GcsObjectStorage implements ObjectStorage {

    private final ObjectProvider<Storage> storage;

    public GcsObjectStorage(ObjectProvider<Storage> storage) {
        this.storage = storage;
    }

    @Override
    public boolean exists(String uri) {
        BlobId blobId = BlobId.fromGsUtilUri(uri);
        Blob blob = storage.getObject().get(blobId);
        boolean exists = blob != null;
        log.debug("[GCS] {} exists={}", uri, exists);
        return exists;
    }
}
