package com.example.fileshelf.storage;

import com.example.fileshelf.exception.ObjectStorageException;
import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;

import java.io.IOException;

@Slf4j
public abstract class MinioService {

    private final MinioClient minioClient;
    private final String bucketName;

    protected MinioService(MinioClient minioClient, String bucketName) {
        this.minioClient = minioClient;
        this.bucketName = bucketName;
    }

    protected MinioClient minioClient() {
        return minioClient;
    }

    protected String bucketName() {
        return bucketName;
    }

    /**
     * Ensures that the configured Minio bucket exists. If not, it creates it.
     * This method is retryable in case of connection failures to Minio.
     *
     * @throws ObjectStorageException If the bucket could not be checked or created.
     */
    @Retryable(
            retryFor = { ObjectStorageException.class },
            maxAttempts = 3,
            backoff = @Backoff(delay = 500, multiplier = 2),
            recover = "recoverEnsureBucketExists"
    )
    public void ensureBucketExists() {
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucketName).build())) {
                log.info("Bucket '{}' does not exist. Creating it now.", bucketName);
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucketName).build());
                log.info("Bucket '{}' created successfully.", bucketName);
            } else {
                log.debug("Bucket '{}' already exists.", bucketName);
            }
        } catch (IOException e) {
            log.warn("Minio connection or I/O failed during bucket existence check/creation. Retrying...", e);
            throw new ObjectStorageException("Minio connection issue while checking bucket " + bucketName, e);
        } catch (Exception e) {
            log.error("An unexpected error occurred during bucket operation for '{}'.", bucketName, e);
            throw new ObjectStorageException("Failed to ensure bucket " + bucketName, e);
        }
    }

    /**
     * Recovery method for ensureBucketExists.
     * This method is called if all retry attempts for ensureBucketExists fail.
     *
     * @param e The exception that caused all retries to fail.
     */
    @Recover
    public void recoverEnsureBucketExists(ObjectStorageException e) {
        log.error("All retry attempts failed for ensuring bucket '{}' exists. Minio seems persistently unavailable.", bucketName, e);
        throw new ObjectStorageException("Minio service is persistently unavailable, cannot ensure bucket existence.", e);
    }
}
