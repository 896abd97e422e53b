package com.filestorm.ingest.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Copies files into a local storage directory. Only suitable when the consumer
 * and whatever reads the files share a filesystem.
 */
@ApplicationScoped
@Named("local-storage")
public class LocalStorageUploader implements StorageUploader {

    private static final Logger LOG = Logger.getLogger(LocalStorageUploader.class);

    @ConfigProperty(name = "app.storage.local-dir", defaultValue = "/tmp/filestorm_storage")
    String localDir;

    @Override
    public String upload(Path localPath, String originalFilename) {
        Path root = Paths.get(localDir).toAbsolutePath().normalize();
        Path fileName = Paths.get(originalFilename).getFileName();
        if (fileName == null) {
            throw new StorageUploadException("Invalid object name: " + originalFilename);
        }
        Path destination = root.resolve(fileName.toString());
        try {
            Files.createDirectories(root);
            Files.copy(localPath, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new StorageUploadException("Local storage copy failed for " + originalFilename, e);
        }
        LOG.infof("Saved locally: %s", destination);
        return destination.toString();
    }
}
