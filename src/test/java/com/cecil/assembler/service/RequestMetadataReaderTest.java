package com.cecil.assembler.service;

import com.cecil.assembler.dto.DataRequestMetadata;
import com.cecil.assembler.dto.ObjectStoreRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestMetadataReaderTest {

    private final RequestMetadataReader reader = new RequestMetadataReader(new ObjectMapper());

    @Test
    void readsDirectUrlForm() {
        String json = """
                {
                  "provider_name": "planet",
                  "dataset_id": "ds-1",
                  "dataset_name": "NDVI",
                  "dataset_crs": "EPSG:4326",
                  "aoi_id": "aoi-9",
                  "data_request_id": "req-1",
                  "files": [
                    {"url": "https://host/a.tif",
                     "bands": [{"number": 1, "variable_name": "ndvi", "time": "2024-01-01", "time_pattern": "%Y-%m-%d"}]}
                  ],
                  "unknown_extra": true
                }
                """;

        assertThat(reader.isObjectStoreForm(json)).isFalse();
        DataRequestMetadata metadata = reader.readDirect(json);

        assertThat(metadata.datasetCrs()).isEqualTo("EPSG:4326");
        assertThat(metadata.files()).hasSize(1);
        assertThat(metadata.files().get(0).bands().get(0).variableName()).isEqualTo("ndvi");
        assertThat(metadata.files().get(0).bands().get(0).timePattern()).isEqualTo("%Y-%m-%d");
        assertThat(metadata.files().get(0).bands().get(0).nodata()).isNull();
    }

    @Test
    void readsObjectStoreForm() {
        String json = """
                {
                  "provider_name": "sentinel",
                  "dataset_id": "ds-2",
                  "data_request_id": "req-2",
                  "bucket": {"name": "rasters", "prefix": "s2/"},
                  "credentials": {"access_key_id": "AKIA", "secret_access_key": "s3cr3t",
                                  "session_token": "tok", "expiration": "2030-01-01T00:00:00Z"},
                  "file_mapping": {"S2": {"bands": ["red", "nir"], "type": "uint16"}}
                }
                """;

        assertThat(reader.isObjectStoreForm(json)).isTrue();
        ObjectStoreRequest request = reader.readObjectStore(json);

        assertThat(request.bucket().prefix()).isEqualTo("s2/");
        assertThat(request.credentials().expiration()).isEqualTo(OffsetDateTime.parse("2030-01-01T00:00:00Z"));
        assertThat(request.credentials().toString()).doesNotContain("s3cr3t");
        assertThat(request.fileMapping().get("S2").bands()).containsExactly("red", "nir");
        assertThat(request.fileMapping().get("S2").dtype()).isEqualTo("uint16");
    }

    @Test
    void rejectsZeroBandNumber() {
        String json = """
                {"data_request_id": "req-3",
                 "files": [{"url": "a.tif", "bands": [{"number": 0, "variable_name": "v"}]}]}
                """;

        assertThatThrownBy(() -> reader.readDirect(json))
                .isInstanceOf(InvalidRequestMetadataException.class)
                .hasMessageContaining("1-based");
    }

    @Test
    void rejectsDuplicateBandNumbers() {
        String json = """
                {"files": [{"url": "a.tif", "bands": [
                    {"number": 1, "variable_name": "v"},
                    {"number": 1, "variable_name": "w"}]}]}
                """;

        assertThatThrownBy(() -> reader.readDirect(json))
                .isInstanceOf(InvalidRequestMetadataException.class)
                .hasMessageContaining("twice");
    }

    @Test
    void rejectsObjectStoreRequestWithoutCredentials() {
        String json = """
                {"bucket": {"name": "rasters"}, "file_mapping": {"S2": {"bands": ["red"]}}}
                """;

        assertThatThrownBy(() -> reader.readObjectStore(json))
                .isInstanceOf(InvalidRequestMetadataException.class)
                .hasMessageContaining("credentials");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> reader.readDirect("{\"files\": ["))
                .isInstanceOf(InvalidRequestMetadataException.class);
        assertThatThrownBy(() -> reader.readDirect("[]"))
                .isInstanceOf(InvalidRequestMetadataException.class);
    }
}
