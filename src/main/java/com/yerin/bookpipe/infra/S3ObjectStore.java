package com.yerin.bookpipe.infra;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.domain.ObjectStore;
import com.yerin.bookpipe.global.exception.ArtifactNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

@Slf4j
@Component
public class S3ObjectStore implements ObjectStore {

    private static final String DEFAULT_PREFIX = "books";

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;
    private final TransientRetry retry;

    public S3ObjectStore(S3Client s3Client, BookpipeProperties properties) {
        this.s3Client = s3Client;
        this.bucket = properties.getStorage().getBucket().trim();
        this.prefix = normalizePrefix(properties.getStorage().getPathPrefix());
        this.retry = new TransientRetry("object-store", properties.getClient(), S3ObjectStore::isTransient);
    }

    @Override
    public void put(String key, byte[] content, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(resolve(key))
                .contentType(contentType == null ? "application/octet-stream" : contentType)
                .contentLength((long) content.length)
                .build();
        retry.run("put", () -> s3Client.putObject(request, RequestBody.fromBytes(content)));
        log.debug("[ObjectStore] put key={}, bytes={}", key, content.length);
    }

    @Override
    public byte[] get(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(resolve(key))
                .build();
        try {
            return retry.call("get", () -> s3Client.getObjectAsBytes(request).asByteArray());
        } catch (NoSuchKeyException e) {
            throw new ArtifactNotFoundException(key);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new ArtifactNotFoundException(key);
            }
            throw e;
        }
    }

    @Override
    public long size(String key) {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(resolve(key))
                .build();
        try {
            Long length = retry.call("head", () -> s3Client.headObject(request).contentLength());
            return length == null ? 0L : length;
        } catch (NoSuchKeyException e) {
            throw new ArtifactNotFoundException(key);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new ArtifactNotFoundException(key);
            }
            throw e;
        }
    }

    @Override
    public void delete(String key) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(resolve(key))
                .build();
        retry.run("delete", () -> s3Client.deleteObject(request));
    }

    @Override
    public void copy(String sourceKey, String targetKey) {
        CopyObjectRequest request = CopyObjectRequest.builder()
                .sourceBucket(bucket)
                .sourceKey(resolve(sourceKey))
                .destinationBucket(bucket)
                .destinationKey(resolve(targetKey))
                .build();
        try {
            retry.run("copy", () -> s3Client.copyObject(request));
        } catch (NoSuchKeyException e) {
            throw new ArtifactNotFoundException(sourceKey);
        }
    }

    @Override
    public boolean ping() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return true;
        } catch (Exception e) {
            log.warn("[ObjectStore] ping failed bucket={}, err={}", bucket, e.toString());
            return false;
        }
    }

    String resolve(String key) {
        String trimmed = key;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return prefix + "/" + trimmed;
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof S3Exception s3) {
            return s3.statusCode() >= 500 || s3.statusCode() == 429;
        }
        return e instanceof SdkClientException;
    }

    private static String normalizePrefix(String rawPrefix) {
        if (rawPrefix == null || rawPrefix.isBlank()) {
            return DEFAULT_PREFIX;
        }
        String trimmed = rawPrefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? DEFAULT_PREFIX : trimmed;
    }
}
