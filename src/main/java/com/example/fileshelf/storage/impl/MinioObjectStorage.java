package com.example.fileshelf.storage.impl;

import com.example.fileshelf.exception.ObjectNotFoundException;
import com.example.fileshelf.exception.ObjectStorageException;
import com.example.fileshelf.storage.MinioService;
import com.example.fileshelf.storage.ObjectStat;
import com.example.fileshelf.storage.ObjectStorage;
import io.minio.GetPresignedObjectUrlArgs;
import io.minio.MinioClient;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.http.Method;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link ObjectStorage} on an S3-compatible bucket through the Minio client.
 * Transient failures are retried; a missing object is reported at once.
 */
@Slf4j
@Service
public class MinioObjectStorage extends MinioService implements ObjectStorage {

    private static final Set<String> MISSING_OBJECT_CODES = Set.of("NoSuchKey", "NoSuchObject", "NoSuchBucket");

    private final Duration uploadUrlExpiry;
    private final Duration downloadUrlExpiry;

    public MinioObjectStorage(MinioClient minioClient,
                              @Value("${minio.bucket}") String bucketName,
                              @Value("${minio.upload-url-expiry:PT5M}") Duration uploadUrlExpiry,
                              @Value("${minio.download-url-expiry:PT6H}") Duration downloadUrlExpiry) {
        super(minioClient, bucketName);
        this.uploadUrlExpiry = uploadUrlExpiry;
        this.downloadUrlExpiry = downloadUrlExpiry;
    }

    @Override
    @Retryable(
            retryFor = { ObjectStorageException.class },
            noRetryFor = { ObjectNotFoundException.class },
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2),
            recover = "recoverStatObject"
    )
    public ObjectStat statObject(String objectName) {
        try {
            StatObjectResponse stat = minioClient().statObject(
                    StatObjectArgs.builder()
                            .bucket(bucketName())
                            .object(objectName)
                            .build()
            );
            return new ObjectStat(objectName, stat.size());
        } catch (ErrorResponseException e) {
            if (MISSING_OBJECT_CODES.contains(e.errorResponse().code())) {
                throw new ObjectNotFoundException(objectName, e);
            }
            throw new ObjectStorageException("Failed to stat object " + objectName, e);
        } catch (IOException e) {
            throw new ObjectStorageException("Minio connection issue, triggering retry.", e);
        } catch (Exception e) {
            throw new ObjectStorageException("Failed to stat object " + objectName, e);
        }
    }

    @Override
    @Retryable(
            retryFor = { ObjectStorageException.class },
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2),
            recover = "recoverDeleteObject"
    )
    public void deleteObject(String objectName) {
        try {
            minioClient().removeObject(
                    RemoveObjectArgs.builder()
                            .bucket(bucketName())
                            .object(objectName)
                            .build()
            );
            log.info("Removed object {} from bucket {}", objectName, bucketName());
        } catch (IOException e) {
            throw new ObjectStorageException("Minio connection issue, triggering retry.", e);
        } catch (Exception e) {
            throw new ObjectStorageException("Failed to remove object " + objectName, e);
        }
    }

    @Override
    public String presignUpload(String objectName) {
        return presign(Method.PUT, objectName, uploadUrlExpiry);
    }

    @Override
    public String presignDownload(String objectName) {
        return presign(Method.GET, objectName, downloadUrlExpiry);
    }

    private String presign(Method method, String objectName, Duration expiry) {
        try {
            return minioClient().getPresignedObjectUrl(
                    GetPresignedObjectUrlArgs.builder()
                            .method(method)
                            .bucket(bucketName())
                            .object(objectName)
                            .expiry((int) expiry.toSeconds(), TimeUnit.SECONDS)
                            .build()
            );
        } catch (Exception e) {
            throw new ObjectStorageException("Failed to generate pre-signed URL for " + objectName, e);
        }
    }

    /**
     * Recovery method for statObject. A missing object is passed through untouched;
     * anything else means Minio stayed unavailable for every attempt.
     */
    @Recover
    public ObjectStat recoverStatObject(ObjectStorageException e, String objectName) {
        if (e instanceof ObjectNotFoundException) {
            throw e;
        }
        log.error("All retry attempts failed for stat of object: {}. Minio seems persistently unavailable.", objectName, e);
        throw new ObjectStorageException("Minio service is currently unavailable for object stat.", e);
    }

    @Recover
    public void recoverDeleteObject(ObjectStorageException e, String objectName) {
        log.error("All retry attempts failed for removing object: {}. Minio seems persistently unavailable.", objectName, e);
        throw new ObjectStorageException("Minio service is currently unavailable for object removal.", e);
    }
}
