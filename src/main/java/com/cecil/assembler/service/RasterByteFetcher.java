package com.cecil.assembler.service;

import com.google.common.io.ByteStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.util.FileCopyUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;

/**
 * Downloads the raw bytes of a raster file. {@code s3://bucket/key} goes through the run's object-store
 * client; {@code http(s)://}, {@code file:} and {@code classpath:} locations go through Spring's
 * {@link ResourceLoader}; anything else is taken as a local path.
 */
@Service
public class RasterByteFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RasterByteFetcher.class);

    static final String S3_SCHEME = "s3://";

    private final ResourceLoader resourceLoader;

    public RasterByteFetcher(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * @throws IOException if the location cannot be read; object-store failures surface as
     *                     {@link RasterSourceException}
     */
    public byte[] fetch(String location, AssemblyRun run) throws IOException {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Raster location is empty");
        }
        if (location.startsWith(S3_SCHEME)) {
            return fetchObject(ObjectLocation.parse(location), run);
        }
        Resource resource = resourceLoader.getResource(toResourceLocation(location));
        if (resource.isFile() && !resource.exists()) {
            throw new FileNotFoundException("Raster file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            byte[] bytes = FileCopyUtils.copyToByteArray(in);
            logger.debug("Fetched {} bytes from {}", bytes.length, location);
            return bytes;
        }
    }

    /**
     * Reads at most the first {@code length} bytes of {@code location}. Object-store reads use a ranged GET;
     * other locations stop reading their stream after {@code length} bytes. A result shorter than
     * {@code length} holds the whole file.
     */
    public byte[] fetchPrefix(String location, int length, AssemblyRun run) throws IOException {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Raster location is empty");
        }
        if (length < 1) {
            throw new IllegalArgumentException("Prefix length must be positive, got " + length);
        }
        if (location.startsWith(S3_SCHEME)) {
            return fetchObject(ObjectLocation.parse(location), "bytes=0-" + (length - 1), run);
        }
        Resource resource = resourceLoader.getResource(toResourceLocation(location));
        if (resource.isFile() && !resource.exists()) {
            throw new FileNotFoundException("Raster file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            byte[] bytes = ByteStreams.toByteArray(ByteStreams.limit(in, length));
            logger.debug("Fetched {} leading bytes from {}", bytes.length, location);
            return bytes;
        }
    }

    private byte[] fetchObject(ObjectLocation object, AssemblyRun run) {
        return fetchObject(object, null, run);
    }

    private byte[] fetchObject(ObjectLocation object, String range, AssemblyRun run) {
        try {
            GetObjectRequest.Builder request = GetObjectRequest.builder()
                    .bucket(object.bucket())
                    .key(object.key());
            if (range != null) {
                request.range(range);
            }
            byte[] bytes = run.objectStoreClient().getObjectAsBytes(request.build()).asByteArray();
            logger.debug("Fetched {} bytes from s3://{}/{}{}", bytes.length, object.bucket(), object.key(),
                    range != null ? " (" + range + ")" : "");
            return bytes;
        } catch (SdkException e) {
            throw new RasterSourceException("Failed to read s3://" + object.bucket() + "/" + object.key()
                    + ": " + e.getMessage(), e);
        }
    }

    static String toResourceLocation(String location) {
        if (location.contains("://") || location.startsWith("file:") || location.startsWith("classpath:")) {
            return location;
        }
        return Paths.get(location).toUri().toString();
    }

    /**
     * Bucket and key of an {@code s3://bucket/key} URL.
     */
    record ObjectLocation(String bucket, String key) {

        static ObjectLocation parse(String s3Uri) {
            if (s3Uri == null || !s3Uri.startsWith(S3_SCHEME)) {
                throw new IllegalArgumentException("Invalid S3 URI format: Must start with s3://. Received: " + s3Uri);
            }
            String pathPart = s3Uri.substring(S3_SCHEME.length());
            int firstSlashIndex = pathPart.indexOf('/');
            if (firstSlashIndex <= 0 || firstSlashIndex == pathPart.length() - 1) {
                throw new IllegalArgumentException("Invalid S3 URI format. Expected s3://bucket/key. Received: " + s3Uri);
            }
            return new ObjectLocation(pathPart.substring(0, firstSlashIndex), pathPart.substring(firstSlashIndex + 1));
        }
    }
}
