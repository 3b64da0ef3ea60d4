package com.cecil.assembler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Resolved metadata of a data request whose raster files live under an object-store prefix.
 */
public record ObjectStoreRequest(
        @JsonProperty("provider_name") String providerName,
        @JsonProperty("dataset_id") String datasetId,
        @JsonProperty("dataset_name") String datasetName,
        @JsonProperty("aoi_id") String aoiId,
        @JsonProperty("data_request_id") String dataRequestId,
        @JsonProperty("bucket") BucketLocation bucket,
        @JsonProperty("credentials") TemporaryCredentials credentials,
        @JsonProperty("file_mapping") Map<String, FileLayout> fileMapping
) {
    public ObjectStoreRequest {
        fileMapping = fileMapping == null ? Map.of() : Map.copyOf(fileMapping);
    }
}
