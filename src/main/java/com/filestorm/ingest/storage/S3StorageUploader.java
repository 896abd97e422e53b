package com.filestorm.ingest.storage;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.net.URI;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Uploads files to an S3-compatible bucket (AWS S3, Cloudflare R2, MinIO).
 * <p>
 * The returned URL is, in order of preference: {@code <public-base-url>/<object>},
 * {@code <endpoint>/<bucket>/<object>}, or the AWS virtual-host URL.
 */
@ApplicationScoped
@Named("s3-storage")
public class S3StorageUploader implements StorageUploader {

    private static final Logger LOG = Logger.getLogger(S3StorageUploader.class);

    @ConfigProperty(name = "s3.endpoint-url")
    Optional<String> endpointUrl;

    @ConfigProperty(name = "s3.aws.region", defaultValue = "us-east-1")
    String region;

    @ConfigProperty(name = "s3.aws.credentials.static-provider.access-key-id")
    Optional<String> accessKeyId;

    @ConfigProperty(name = "s3.aws.credentials.static-provider.secret-access-key")
    Optional<String> secretAccessKey;

    @ConfigProperty(name = "app.storage.bucket", defaultValue = "filestorm-uploads")
    String bucketName;

    @ConfigProperty(name = "app.storage.public-base-url")
    Optional<String> publicBaseUrl;

    private S3Client s3Client;

    @Override
    public String upload(Path localPath, String originalFilename) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(originalFilename)
                .contentType("application/octet-stream")
                .build();
        try {
            client().putObject(request, RequestBody.fromFile(localPath));
        } catch (Exception e) {
            throw new StorageUploadException("S3 upload failed for " + originalFilename, e);
        }
        String url = objectUrl(originalFilename);
        LOG.infof("Uploaded to S3: %s", url);
        return url;
    }

    String objectUrl(String objectName) {
        if (publicBaseUrl.isPresent() && !publicBaseUrl.get().isBlank()) {
            return stripTrailingSlash(publicBaseUrl.get()) + "/" + objectName;
        }
        if (endpointUrl.isPresent() && !endpointUrl.get().isBlank()) {
            return stripTrailingSlash(endpointUrl.get()) + "/" + bucketName + "/" + objectName;
        }
        return "https://" + bucketName + ".s3." + region + ".amazonaws.com/" + objectName;
    }

    private synchronized S3Client client() {
        if (s3Client == null) {
            S3ClientBuilder builder = S3Client.builder().region(Region.of(region));
            if (endpointUrl.isPresent() && !endpointUrl.get().isBlank()) {
                LOG.infof("Initializing S3 client for custom endpoint: %s", endpointUrl.get());
                builder.endpointOverride(URI.create(endpointUrl.get()))
                        .forcePathStyle(true);
            }
            if (accessKeyId.isPresent() && secretAccessKey.isPresent()) {
                builder.credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKeyId.get(), secretAccessKey.get())));
            }
            s3Client = builder.build();
            LOG.info("S3 client initialized successfully");
        }
        return s3Client;
    }

    @PreDestroy
    synchronized void close() {
        if (s3Client != null) {
            s3Client.close();
            s3Client = null;
        }
    }

    private static String stripTrailingSlash(String value) {
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
