package com.github.challengeplatform.submissionengine.storage;

import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.errors.MinioException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.util.Map;

/**
 * Stores submission files in an S3 compatible bucket.
 *
 * @author timo.buechert
 */
@Service
@Slf4j
public class MinioObjectStorageService implements ObjectStorageService {

    private final MinioClient minioClient;

    private final String endpoint;

    private final String bucketName;

    private volatile boolean bucketVerified = false;

    public MinioObjectStorageService(final MinioClient minioClient,
                                     @Value("${minio.url}") final String endpoint,
                                     @Value("${minio.bucket.submissions}") final String bucketName) {
        this.minioClient = minioClient;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.bucketName = bucketName;
    }

    @Override
    public String store(final String objectKey, final byte[] content, final String contentType,
                        final Map<String, String> metadata) {
        ensureBucketExists();

        try (InputStream stream = new ByteArrayInputStream(content)) {
            minioClient.putObject(PutObjectArgs.builder()
                    .bucket(bucketName)
                    .object(objectKey)
                    .stream(stream, content.length, -1)
                    .contentType(contentType)
                    .userMetadata(metadata)
                    .build());
        } catch (final MinioException | IOException | GeneralSecurityException e) {
            log.error("Could not store object {} in bucket {}", objectKey, bucketName, e);
            throw new StorageException("Could not store object " + objectKey + ": " + e.getMessage(), e);
        }

        return urlOf(objectKey);
    }

    String urlOf(final String objectKey) {
        return endpoint + "/" + bucketName + "/" + objectKey;
    }

    private void ensureBucketExists() {
        if (bucketVerified) {
            return;
        }

        synchronized (this) {
            if (bucketVerified) {
                return;
            }
            try {
                final boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucketName).build());
                if (!found) {
                    minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucketName).build());
                    log.info("Bucket '{}' created successfully.", bucketName);
                }
                bucketVerified = true;
            } catch (final MinioException | IOException | GeneralSecurityException e) {
                throw new StorageException("Could not verify bucket " + bucketName + ": " + e.getMessage(), e);
            }
        }
    }

}
