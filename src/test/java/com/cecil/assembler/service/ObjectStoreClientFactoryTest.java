package com.cecil.assembler.service;

import com.cecil.assembler.dto.TemporaryCredentials;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import software.amazon.awssdk.services.s3.S3Client;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class ObjectStoreClientFactoryTest {

    private final ObjectStoreClientFactory clientFactory = new ObjectStoreClientFactory("us-east-1", "");

    @Test
    void expiredCredentialsAreReportedByRequestNotByKey(CapturedOutput output) {
        TemporaryCredentials expired = new TemporaryCredentials("AKIAEXPIREDKEY", "secret", "token",
                OffsetDateTime.now().minusHours(1));

        try (S3Client client = clientFactory.create(expired, "req-expired")) {
            assertThat(client).isNotNull();
        }

        assertThat(output).contains("[req-expired] Temporary credentials expired");
        assertThat(output).doesNotContain("AKIAEXPIREDKEY");
    }

    @Test
    void endpointOverrideBuildsClient() {
        ObjectStoreClientFactory local = new ObjectStoreClientFactory("eu-west-1", "http://localhost:9000");

        try (S3Client client = local.create(new TemporaryCredentials("AKIA", "secret", "token", null), "req-local")) {
            assertThat(client.serviceClientConfiguration().region().id()).isEqualTo("eu-west-1");
        }
    }
}
