package com.cecil.assembler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Resolved metadata of a data request whose raster files are addressed by URL.
 */
public record DataRequestMetadata(
        @JsonProperty("provider_name") String providerName,
        @JsonProperty("dataset_id") String datasetId,
        @JsonProperty("dataset_name") String datasetName,
        @JsonProperty("dataset_crs") String datasetCrs,
        @JsonProperty("aoi_id") String aoiId,
        @JsonProperty("data_request_id") String dataRequestId,
        @JsonProperty("files") List<FileDescriptor> files
) {
    public DataRequestMetadata {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
