package com.cecil.assembler.service;

import com.cecil.assembler.dto.BandDescriptor;
import com.cecil.assembler.dto.DataRequestMetadata;
import com.cecil.assembler.dto.FileDescriptor;
import com.cecil.assembler.dto.FileLayout;
import com.cecil.assembler.dto.ObjectStoreRequest;
import com.cecil.assembler.dto.TemporaryCredentials;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads request metadata handed over by the metadata service, in either the direct-URL or the object-store
 * shape, and checks the invariants the assembler relies on.
 */
@Service
public class RequestMetadataReader {

    private final ObjectMapper objectMapper;

    public RequestMetadataReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public boolean isObjectStoreForm(String json) {
        return isObjectStoreForm(tree(json));
    }

    public DataRequestMetadata readDirect(String json) {
        return validate(convert(tree(json), DataRequestMetadata.class));
    }

    public DataRequestMetadata readDirect(InputStream json) throws IOException {
        return validate(convert(objectMapper.readTree(json), DataRequestMetadata.class));
    }

    public ObjectStoreRequest readObjectStore(String json) {
        return validate(convert(tree(json), ObjectStoreRequest.class));
    }

    public ObjectStoreRequest readObjectStore(InputStream json) throws IOException {
        return validate(convert(objectMapper.readTree(json), ObjectStoreRequest.class));
    }

    /**
     * @throws InvalidRequestMetadataException if a file has no URL, a band has no variable or a non-positive
     *                                         number, or a band number repeats within a file
     */
    public static DataRequestMetadata validate(DataRequestMetadata metadata) {
        if (metadata == null) {
            throw new InvalidRequestMetadataException("Request metadata is missing");
        }
        for (FileDescriptor file : metadata.files()) {
            if (isBlank(file.url())) {
                throw new InvalidRequestMetadataException("File without url in request " + metadata.dataRequestId());
            }
            Set<Integer> numbers = new HashSet<>();
            for (BandDescriptor band : file.bands()) {
                if (band.number() < 1) {
                    throw new InvalidRequestMetadataException("Band number " + band.number() + " of " + file.url()
                            + " is not 1-based");
                }
                if (isBlank(band.variableName())) {
                    throw new InvalidRequestMetadataException("Band " + band.number() + " of " + file.url()
                            + " has no variable_name");
                }
                if (!numbers.add(band.number())) {
                    throw new InvalidRequestMetadataException("Band " + band.number() + " appears twice in " + file.url());
                }
            }
        }
        return metadata;
    }

    /**
     * @throws InvalidRequestMetadataException if the bucket, credentials or a layout's bands are missing
     */
    public static ObjectStoreRequest validate(ObjectStoreRequest request) {
        if (request == null) {
            throw new InvalidRequestMetadataException("Request metadata is missing");
        }
        if (request.bucket() == null || isBlank(request.bucket().name())) {
            throw new InvalidRequestMetadataException("Request " + request.dataRequestId() + " has no bucket name");
        }
        TemporaryCredentials credentials = request.credentials();
        if (credentials == null || isBlank(credentials.accessKeyId()) || isBlank(credentials.secretAccessKey())) {
            throw new InvalidRequestMetadataException("Request " + request.dataRequestId() + " has no credentials");
        }
        for (Map.Entry<String, FileLayout> entry : request.fileMapping().entrySet()) {
            FileLayout layout = entry.getValue();
            if (layout == null || layout.bands().isEmpty()) {
                throw new InvalidRequestMetadataException("File mapping '" + entry.getKey() + "' declares no bands");
            }
            if (layout.bands().stream().anyMatch(RequestMetadataReader::isBlank)) {
                throw new InvalidRequestMetadataException("File mapping '" + entry.getKey() + "' has a blank band name");
            }
        }
        return request;
    }

    private static boolean isObjectStoreForm(JsonNode root) {
        return root.has("bucket") && !root.has("files");
    }

    private JsonNode tree(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new InvalidRequestMetadataException("Request metadata must be a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidRequestMetadataException("Malformed request metadata: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T convert(JsonNode root, Class<T> type) {
        try {
            return objectMapper.treeToValue(root, type);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestMetadataException("Request metadata does not match " + type.getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
