package com.cecil.assembler.service;

import com.cecil.assembler.dto.DataRequestMetadata;
import com.cecil.assembler.dto.ObjectStoreRequest;
import com.cecil.assembler.model.AssembledDataset;
import com.cecil.assembler.model.GriddedArray;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attaches request provenance to a combined dataset. Arrays are passed through untouched.
 */
@Service
public class AttributeBinder {

    public static final String PROVIDER_NAME = "provider_name";
    public static final String DATASET_ID = "dataset_id";
    public static final String DATASET_NAME = "dataset_name";
    public static final String DATASET_CRS = "dataset_crs";
    public static final String AOI_ID = "aoi_id";
    public static final String DATA_REQUEST_ID = "data_request_id";

    public AssembledDataset bind(Map<String, GriddedArray> variables, DataRequestMetadata metadata, AssemblyRun run) {
        return bind(variables, attributes(metadata.providerName(), metadata.datasetId(), metadata.datasetName(),
                metadata.datasetCrs(), metadata.aoiId(), metadata.dataRequestId()), run);
    }

    /**
     * @param crs CRS of the request's authoritative grid
     */
    public AssembledDataset bind(Map<String, GriddedArray> variables, ObjectStoreRequest request, String crs, AssemblyRun run) {
        return bind(variables, attributes(request.providerName(), request.datasetId(), request.datasetName(),
                crs, request.aoiId(), request.dataRequestId()), run);
    }

    private AssembledDataset bind(Map<String, GriddedArray> variables, Map<String, String> attributes, AssemblyRun run) {
        return new AssembledDataset(variables, attributes, run.getDiagnostics(), run.releaseResources());
    }

    private static Map<String, String> attributes(String providerName,
                                                  String datasetId,
                                                  String datasetName,
                                                  String datasetCrs,
                                                  String aoiId,
                                                  String dataRequestId) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(PROVIDER_NAME, providerName);
        attributes.put(DATASET_ID, datasetId);
        attributes.put(DATASET_NAME, datasetName);
        attributes.put(DATASET_CRS, datasetCrs);
        attributes.put(AOI_ID, aoiId);
        attributes.put(DATA_REQUEST_ID, dataRequestId);
        return attributes;
    }
}
