package com.filestorm.ingest.normalize;

import com.filestorm.ingest.domain.FileEventRecord;
import com.filestorm.ingest.domain.MalformedEventException;
import com.filestorm.ingest.domain.UploadEvent;
import com.filestorm.ingest.storage.StorageUploaderFacade;
import com.filestorm.ingest.util.TimestampParser;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;

/**
 * Turns a raw stream entry into a {@link FileEventRecord}, or classifies it as skip / error.
 * <p>
 * Two event variants exist:
 * <ul>
 *   <li>{@code already_stored=true}: the intake component already put the bytes in object
 *       storage; the event must carry the storage URL.</li>
 *   <li>legacy: the event points at a local temp file which is uploaded here. The file is left
 *       in place and handed back in the result; it is removed once the record is durable.</li>
 * </ul>
 * The storage uploader is called at most once per delivery, and only on the legacy path.
 */
@ApplicationScoped
public class MessageNormalizer {

    private static final Logger LOG = Logger.getLogger(MessageNormalizer.class);

    @Inject
    StorageUploaderFacade storageUploader;

    Clock clock = Clock.systemUTC();

    public NormalizationResult normalize(String messageId, Map<String, String> fields) {
        try {
            UploadEvent event = UploadEvent.fromFields(fields, TimestampParser.entryIdTime(messageId, clock));
            if (event.isAlreadyStored()) {
                return normalizeStored(messageId, event);
            }
            return normalizeLegacy(messageId, event);
        } catch (MalformedEventException e) {
            LOG.warnf("Skipping malformed entry %s: %s", messageId, e.getMessage());
            return NormalizationResult.skip(e.getMessage());
        } catch (Exception e) {
            LOG.errorf(e, "Error processing entry %s", messageId);
            return NormalizationResult.error(e);
        }
    }

    private NormalizationResult normalizeStored(String messageId, UploadEvent event) {
        if (event.getStorageLocator() == null) {
            LOG.warnf("No storage URL provided for entry %s, skipping", messageId);
            return NormalizationResult.skip("missing storage locator");
        }
        return NormalizationResult.success(FileEventRecord.of(event, event.getStorageLocator(), messageId));
    }

    private NormalizationResult normalizeLegacy(String messageId, UploadEvent event) {
        Path tempFile = resolveTempFile(event.getTempPath());
        if (tempFile == null || !Files.exists(tempFile)) {
            LOG.warnf("File not found: %s - skipping entry %s", event.getTempPath(), messageId);
            return NormalizationResult.skip("temp file not found");
        }

        String storageUrl = storageUploader.upload(tempFile, event.getFilename());
        return NormalizationResult.success(FileEventRecord.of(event, storageUrl, messageId), tempFile);
    }

    private static Path resolveTempFile(String tempPath) {
        if (tempPath == null) {
            return null;
        }
        try {
            return Paths.get(tempPath);
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
