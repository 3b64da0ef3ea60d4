package com.cecil.assembler.service;

import com.cecil.assembler.dto.BandDescriptor;
import com.cecil.assembler.dto.BucketLocation;
import com.cecil.assembler.dto.FileDescriptor;
import com.cecil.assembler.dto.FileLayout;
import com.cecil.assembler.dto.ObjectStoreRequest;
import com.cecil.assembler.dto.TemporaryCredentials;
import com.cecil.assembler.model.AssemblyDiagnostic;
import com.cecil.assembler.model.AssemblyOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ObjectStoreFileLocatorTest {

    private static final TemporaryCredentials CREDENTIALS = new TemporaryCredentials("AKIA", "secret", "token", null);

    @Mock
    private ObjectStoreClientFactory clientFactory;

    @Mock
    private S3Client s3Client;

    private final ObjectStoreFileLocator locator = new ObjectStoreFileLocator();
    private AssemblyRun run;

    @BeforeEach
    void setUp() {
        lenient().when(clientFactory.create(CREDENTIALS, "req-os")).thenReturn(s3Client);
        run = new AssemblyRun("req-os", AssemblyOptions.builder().build(), CancellationSignal.none(), CREDENTIALS, clientFactory);
    }

    @Test
    void locatesMappedObjectsAcrossPages() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(page(true, "tok-1", "sat/2024/01/02/00/00/00/S2.tif", "sat/2024/01/02/00/00/00/thumb.png"))
                .thenReturn(page(false, null, "sat/2024/01/01/00/00/00/S2.tif"));

        List<FileDescriptor> files = locator.locate(request(Map.of("S2", new FileLayout(List.of("red", "nir"), "uint16"))), run);

        assertThat(files).extracting(FileDescriptor::url).containsExactly(
                "s3://bucket/sat/2024/01/02/00/00/00/S2.tif",
                "s3://bucket/sat/2024/01/01/00/00/00/S2.tif");
        assertThat(files.get(0).bands()).containsExactly(
                new BandDescriptor(1, "red", "2024/01/02/00/00/00", "%Y/%m/%d/%H/%M/%S", "uint16", null),
                new BandDescriptor(2, "nir", "2024/01/02/00/00/00", "%Y/%m/%d/%H/%M/%S", "uint16", null));

        ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3Client, times(2)).listObjectsV2(captor.capture());
        assertThat(captor.getAllValues().get(0).prefix()).isEqualTo("sat/");
        assertThat(captor.getAllValues().get(0).continuationToken()).isNull();
        assertThat(captor.getAllValues().get(1).continuationToken()).isEqualTo("tok-1");
    }

    @Test
    void zeroTimestampMeansUntimed() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(page(false, null, "sat/0000/00/00/00/00/00/DEM.tif"));

        List<FileDescriptor> files = locator.locate(request(Map.of("DEM", new FileLayout(List.of("elev"), null))), run);

        assertThat(files.get(0).bands().get(0).time()).isNull();
        assertThat(files.get(0).bands().get(0).timePattern()).isNull();
        assertThat(run.getDiagnostics()).isEmpty();
    }

    @Test
    void keyWithoutTimestampIsUntimedAndReported() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(page(false, null, "sat/static/DEM.tif"));

        List<FileDescriptor> files = locator.locate(request(Map.of("DEM", new FileLayout(List.of("elev"), null))), run);

        assertThat(files.get(0).bands().get(0).time()).isNull();
        assertThat(run.getDiagnostics()).extracting(AssemblyDiagnostic::kind)
                .containsExactly(AssemblyDiagnostic.Kind.MISSING_TIMESTAMP);
    }

    @Test
    void listingFailureBecomesSourceFailure() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        assertThatThrownBy(() -> locator.locate(request(Map.of()), run))
                .isInstanceOf(RasterSourceException.class)
                .hasMessageContaining("s3://bucket/sat/");
    }

    @Test
    void fileNameDropsDirectoriesAndExtension() {
        assertThat(ObjectStoreFileLocator.fileName("a/b/S2_L2A.tif")).isEqualTo("S2_L2A");
        assertThat(ObjectStoreFileLocator.fileName("a/b/archive.tar.gz")).isEqualTo("archive.tar");
        assertThat(ObjectStoreFileLocator.fileName("noext")).isEqualTo("noext");
    }

    private static ObjectStoreRequest request(Map<String, FileLayout> mapping) {
        return new ObjectStoreRequest("sentinel", "ds-1", "Sentinel-2", "aoi-7", "req-os",
                new BucketLocation("bucket", "sat/"), CREDENTIALS, mapping);
    }

    private static ListObjectsV2Response page(boolean truncated, String nextToken, String... keys) {
        List<S3Object> objects = new ArrayList<>();
        for (String key : keys) {
            objects.add(S3Object.builder().key(key).build());
        }
        return ListObjectsV2Response.builder()
                .contents(objects)
                .isTruncated(truncated)
                .nextContinuationToken(nextToken)
                .build();
    }
}
