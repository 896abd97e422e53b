package com.filestorm.ingest.normalize;

import com.filestorm.ingest.domain.FileEventRecord;
import com.filestorm.ingest.domain.Operation;
import com.filestorm.ingest.storage.StorageUploadException;
import com.filestorm.ingest.storage.StorageUploaderFacade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MessageNormalizerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    StorageUploaderFacade storageUploader;

    @TempDir
    Path tempDir;

    private MessageNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new MessageNormalizer();
        normalizer.storageUploader = storageUploader;
        normalizer.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    void storedEventBecomesRecordKeyedByEntryId() {
        Map<String, String> fields = new HashMap<>();
        fields.put("operation", "upload");
        fields.put("filename", "report.pdf");
        fields.put("size", "1024");
        fields.put("mime_type", "application/pdf");
        fields.put("storage_url", "s3://uploads/report.pdf");
        fields.put("uploader_id", "user-7");
        fields.put("ts", "2023-12-07T10:30:00.123456+00:00");
        fields.put("already_stored", "true");

        NormalizationResult result = normalizer.normalize("1700000000000-0", fields);

        assertThat(result.getStatus()).isEqualTo(NormalizationStatus.SUCCESS);
        FileEventRecord record = result.getRecord();
        assertThat(record.getOperation()).isEqualTo(Operation.UPLOAD);
        assertThat(record.getFilename()).isEqualTo("report.pdf");
        assertThat(record.getFileSize()).isEqualTo(1024L);
        assertThat(record.getMimeType()).isEqualTo("application/pdf");
        assertThat(record.getStorageUrl()).isEqualTo("s3://uploads/report.pdf");
        assertThat(record.getUploaderId()).isEqualTo("user-7");
        assertThat(record.getEventTime()).isEqualTo(Instant.parse("2023-12-07T10:30:00.123456Z"));
        assertThat(record.getDedupKey()).isEqualTo("1700000000000-0");
        verifyNoInteractions(storageUploader);
    }

    @Test
    void storedEventFillsDefaults() {
        Map<String, String> fields = Map.of(
                "filename", "a.txt",
                "storage_locator", "s3://uploads/a.txt",
                "already_stored", "TRUE");

        FileEventRecord record = normalizer.normalize("1700000000000-0", fields).getRecord();

        assertThat(record.getStorageUrl()).isEqualTo("s3://uploads/a.txt");
        assertThat(record.getFileSize()).isZero();
        assertThat(record.getMimeType()).isEqualTo("application/octet-stream");
        assertThat(record.getUploaderId()).isEqualTo("anonymous");
        assertThat(record.getEventTime()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
    }

    @Test
    void unparseableTimestampFallsBackToEntryIdTime() {
        Map<String, String> fields = Map.of(
                "filename", "a.txt",
                "storage_url", "s3://uploads/a.txt",
                "already_stored", "true",
                "ts", "yesterday");

        assertThat(normalizer.normalize("1700000000000-0", fields).getRecord().getEventTime())
                .isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
        assertThat(normalizer.normalize("entry-a", fields).getRecord().getEventTime()).isEqualTo(NOW);
    }

    @Test
    void redeliveryWithoutTimestampKeepsTheSameEventTime() {
        Map<String, String> fields = Map.of(
                "filename", "a.txt",
                "storage_url", "s3://uploads/a.txt",
                "already_stored", "true");

        FileEventRecord first = normalizer.normalize("1700000000000-4", fields).getRecord();
        normalizer.clock = Clock.fixed(NOW.plusSeconds(90), ZoneOffset.UTC);
        FileEventRecord redelivered = normalizer.normalize("1700000000000-4", fields).getRecord();

        assertThat(redelivered.getEventTime()).isEqualTo(first.getEventTime());
        assertThat(redelivered.getDedupKey()).isEqualTo(first.getDedupKey());
    }

    @Test
    void storedEventWithoutLocatorIsSkipped() {
        Map<String, String> fields = Map.of("filename", "a.txt", "already_stored", "true", "storage_url", "  ");

        NormalizationResult result = normalizer.normalize("1-0", fields);

        assertThat(result.getStatus()).isEqualTo(NormalizationStatus.SKIP);
        assertThat(result.getRecord()).isNull();
    }

    @Test
    void malformedEventsAreSkipped() {
        assertThat(normalizer.normalize("1-0", Map.of("already_stored", "true", "storage_url", "s3://x"))
                .getStatus()).isEqualTo(NormalizationStatus.SKIP);
        assertThat(normalizer.normalize("2-0", Map.of("filename", "a.txt", "size", "-1", "already_stored", "true",
                "storage_url", "s3://x")).getStatus()).isEqualTo(NormalizationStatus.SKIP);
        assertThat(normalizer.normalize("3-0", Map.of("filename", "a.txt", "size", "big", "already_stored", "true",
                "storage_url", "s3://x")).getStatus()).isEqualTo(NormalizationStatus.SKIP);
        assertThat(normalizer.normalize("4-0", Map.of("filename", "a.txt", "operation", "delete",
                "already_stored", "true", "storage_url", "s3://x")).getStatus()).isEqualTo(NormalizationStatus.SKIP);
        assertThat(normalizer.normalize("5-0", Map.of()).getStatus()).isEqualTo(NormalizationStatus.SKIP);
        assertThat(normalizer.normalize("6-0", null).getStatus()).isEqualTo(NormalizationStatus.SKIP);
    }

    @Test
    void legacyEventUploadsTempFileAndLeavesItForTheBatch() throws Exception {
        Path tempFile = Files.writeString(tempDir.resolve("upload-123.tmp"), "hello");
        when(storageUploader.upload(tempFile, "a.txt")).thenReturn("s3://uploads/a.txt");

        NormalizationResult result = normalizer.normalize("1-0", Map.of(
                "filename", "a.txt",
                "size", "5",
                "tmp_path", tempFile.toString()));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRecord().getStorageUrl()).isEqualTo("s3://uploads/a.txt");
        assertThat(result.getRecord().getDedupKey()).isEqualTo("1-0");
        assertThat(result.getTempFile()).isEqualTo(tempFile);
        assertThat(tempFile).exists();
    }

    @Test
    void legacyEventAcceptsTempPathAlias() throws Exception {
        Path tempFile = Files.writeString(tempDir.resolve("upload-456.tmp"), "hello");
        when(storageUploader.upload(tempFile, "b.txt")).thenReturn("/tmp/storage/b.txt");

        NormalizationResult result = normalizer.normalize("2-0", Map.of(
                "filename", "b.txt",
                "temp_path", tempFile.toString(),
                "already_stored", "false"));

        assertThat(result.getRecord().getStorageUrl()).isEqualTo("/tmp/storage/b.txt");
        assertThat(result.getTempFile()).isEqualTo(tempFile);
    }

    @Test
    void legacyEventWithMissingTempFileIsSkippedWithoutUpload() {
        NormalizationResult result = normalizer.normalize("1-0", Map.of(
                "filename", "a.txt",
                "tmp_path", tempDir.resolve("gone.tmp").toString()));

        assertThat(result.getStatus()).isEqualTo(NormalizationStatus.SKIP);
        assertThat(normalizer.normalize("2-0", Map.of("filename", "a.txt")).getStatus())
                .isEqualTo(NormalizationStatus.SKIP);
        verifyNoInteractions(storageUploader);
    }

    @Test
    void failedUploadIsAnErrorAndKeepsTempFile() throws Exception {
        Path tempFile = Files.writeString(tempDir.resolve("upload-789.tmp"), "hello");
        StorageUploadException failure = new StorageUploadException("S3 upload failed for a.txt");
        when(storageUploader.upload(tempFile, "a.txt")).thenThrow(failure);

        NormalizationResult result = normalizer.normalize("1-0", Map.of(
                "filename", "a.txt",
                "tmp_path", tempFile.toString()));

        assertThat(result.getStatus()).isEqualTo(NormalizationStatus.ERROR);
        assertThat(result.getCause()).isSameAs(failure);
        assertThat(tempFile).exists();
    }
}
