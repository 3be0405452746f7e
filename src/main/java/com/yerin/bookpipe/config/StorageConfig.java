package com.yerin.bookpipe.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * Aliyun OSS speaks the S3 protocol, so the AWS SDK client is pointed at the OSS endpoint.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(BookpipeProperties properties) {
        BookpipeProperties.Storage config = properties.getStorage();
        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(resolveCredentials(config));

        String region = normalizeText(config.getRegion());
        if (region != null) {
            builder.region(Region.of(region));
        }

        String endpoint = normalizeText(config.getEndpoint());
        if (endpoint != null) {
            if (!endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
                endpoint = "https://" + endpoint;
            }
            builder.endpointOverride(URI.create(endpoint));
        }
        builder.serviceConfiguration(S3Configuration.builder()
                .pathStyleAccessEnabled(config.isPathStyleAccess())
                .build());

        log.info("Object store wired: endpoint={}, region={}, bucket={}, prefix={}",
                endpoint, region, config.getBucket(), config.getPathPrefix());
        return builder.build();
    }

    static AwsCredentialsProvider resolveCredentials(BookpipeProperties.Storage config) {
        String accessKey = normalizeText(config.getAccessKey());
        String secretKey = normalizeText(config.getSecretKey());
        if (accessKey == null && secretKey == null) {
            return DefaultCredentialsProvider.create();
        }
        if (accessKey == null || secretKey == null) {
            throw new IllegalArgumentException("bookpipe.storage.access-key/secret-key 는 함께 설정해야 합니다.");
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }

    private static String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
