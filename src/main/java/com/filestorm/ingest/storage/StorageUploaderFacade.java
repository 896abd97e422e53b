package com.filestorm.ingest.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;

/**
 * Facade that selects the storage backend based on {@code app.storage.mode}.
 */
@ApplicationScoped
public class StorageUploaderFacade implements StorageUploader {

    @ConfigProperty(name = "app.storage.mode", defaultValue = "local")
    String mode;

    @Inject
    @Named("local-storage")
    LocalStorageUploader localUploader;

    @Inject
    @Named("s3-storage")
    S3StorageUploader s3Uploader;

    private StorageUploader delegate() {
        if ("s3".equalsIgnoreCase(mode)) {
            return s3Uploader;
        }
        return localUploader;
    }

    @Override
    public String upload(Path localPath, String originalFilename) {
        return delegate().upload(localPath, originalFilename);
    }
}
