package com.cecil.assembler.service;

import com.cecil.assembler.dto.TemporaryCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.time.OffsetDateTime;

/**
 * Builds S3 clients scoped to a single assembly run. Temporary credentials are handed to the client
 * directly and never written to system properties or the environment.
 */
@Service
public class ObjectStoreClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(ObjectStoreClientFactory.class);

    private final String awsRegion;
    private final String endpoint;

    public ObjectStoreClientFactory(@Value("${aws.region:us-east-1}") String awsRegion,
                                    @Value("${aws.s3.endpoint:}") String endpoint) {
        this.awsRegion = awsRegion;
        this.endpoint = endpoint;
    }

    /**
     * Client signing with a request's temporary credentials.
     *
     * @param requestId data request the credentials were issued for, used in log messages
     */
    public S3Client create(TemporaryCredentials credentials, String requestId) {
        if (credentials.expiration() != null && credentials.expiration().isBefore(OffsetDateTime.now())) {
            logger.warn("[{}] Temporary credentials expired at {}; requests will likely be rejected.",
                    requestId, credentials.expiration());
        }
        AwsSessionCredentials session = AwsSessionCredentials.create(
                credentials.accessKeyId(),
                credentials.secretAccessKey(),
                credentials.sessionToken());
        return builder()
                .credentialsProvider(StaticCredentialsProvider.create(session))
                .build();
    }

    /**
     * Client for {@code s3://} URLs handed over without credentials, using the default provider chain.
     */
    public S3Client createDefault() {
        return builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    private S3ClientBuilder builder() {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(awsRegion))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.none()) // RetryExecutor owns retries
                        .build());
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
        }
        return builder;
    }
}
