package com.filestorm.ingest.storage;

import java.nio.file.Path;

public interface StorageUploader {

    /**
     * Uploads a local file to object storage.
     *
     * @param localPath        file to upload
     * @param originalFilename name the object is stored under
     * @return storage URL or path of the stored object
     * @throws StorageUploadException if the backend rejects or fails the upload
     */
    String upload(Path localPath, String originalFilename);
}
