package com.example.fileshelf.storage;

import com.example.fileshelf.exception.ObjectNotFoundException;

/**
 * Object store holding entry payloads, one object per entry id.
 */
public interface ObjectStorage {

    /**
     * Creates the backing bucket if it is missing.
     */
    void ensureBucketExists();

    /**
     * @throws ObjectNotFoundException if nothing was uploaded under {@code objectName}
     */
    ObjectStat statObject(String objectName);

    void deleteObject(String objectName);

    /**
     * URL the client PUTs the payload to before the entry is finalized.
     */
    String presignUpload(String objectName);

    String presignDownload(String objectName);
}
