package com.example.homemic_backend.service.Interfaces;

import java.nio.file.Path;

/**
 * Blob store for uploaded clip audio, addressed by object key.
 * All failures surface as {@link com.example.homemic_backend.exception.StorageFailureException}.
 */
public interface AudioStorage {

    /** Writes the blob, replacing any previous content. Creates parent folders as needed. */
    void write(String objectKey, byte[] bytes);

    byte[] read(String objectKey);

    /** Local path for streaming the blob back to clients. */
    Path resolve(String objectKey);

    boolean exists(String objectKey);

    void delete(String objectKey);

    Path root();
}
