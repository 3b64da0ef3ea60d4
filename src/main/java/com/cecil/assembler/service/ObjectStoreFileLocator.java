package com.cecil.assembler.service;

import com.cecil.assembler.dto.BandDescriptor;
import com.cecil.assembler.dto.FileDescriptor;
import com.cecil.assembler.dto.FileLayout;
import com.cecil.assembler.dto.ObjectStoreRequest;
import com.cecil.assembler.model.AssemblyDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the raster files of an object-store request: every object under the bucket prefix whose file
 * name appears in the request's file mapping, with bands enumerated from the mapping and the timestamp
 * taken from the key.
 */
@Service
public class ObjectStoreFileLocator {

    private static final Logger logger = LoggerFactory.getLogger(ObjectStoreFileLocator.class);

    static final Pattern KEY_TIMESTAMP = Pattern.compile("\\d{4}/\\d{2}/\\d{2}/\\d{2}/\\d{2}/\\d{2}");
    static final String KEY_TIMESTAMP_PATTERN = "%Y/%m/%d/%H/%M/%S";
    static final String NO_TIME = "0000/00/00/00/00/00";

    /**
     * @return one descriptor per mapped object, in listing order
     */
    public List<FileDescriptor> locate(ObjectStoreRequest request, AssemblyRun run) {
        String bucket = request.bucket().name();
        List<String> keys = listKeys(bucket, request.bucket().prefix(), run);

        List<FileDescriptor> files = new ArrayList<>();
        for (String key : keys) {
            String fileName = fileName(key);
            FileLayout layout = request.fileMapping().get(fileName);
            if (layout == null) {
                logger.debug("Skipping s3://{}/{}: no layout for file name '{}'", bucket, key, fileName);
                continue;
            }
            String timestamp = timestamp(key, run);
            List<BandDescriptor> bands = new ArrayList<>(layout.bands().size());
            for (int i = 0; i < layout.bands().size(); i++) {
                bands.add(new BandDescriptor(i + 1,
                        layout.bands().get(i),
                        timestamp,
                        timestamp != null ? KEY_TIMESTAMP_PATTERN : null,
                        layout.dtype(),
                        null));
            }
            files.add(new FileDescriptor(RasterByteFetcher.S3_SCHEME + bucket + "/" + key, bands));
        }
        logger.info("[{}] Located {} mapped file(s) among {} object(s) under s3://{}/{}",
                run.getRequestId(), files.size(), keys.size(), bucket, nullToEmpty(request.bucket().prefix()));
        return files;
    }

    /**
     * Lists every key under {@code prefix}, following continuation tokens across pages.
     */
    List<String> listKeys(String bucket, String prefix, AssemblyRun run) {
        S3Client client = run.objectStoreClient();
        List<String> keys = new ArrayList<>();
        String continuationToken = null;
        int pages = 0;
        do {
            run.checkCancelled("listing s3://" + bucket + "/" + nullToEmpty(prefix));
            ListObjectsV2Request.Builder builder = ListObjectsV2Request.builder().bucket(bucket);
            if (prefix != null && !prefix.isEmpty()) {
                builder.prefix(prefix);
            }
            if (continuationToken != null) {
                builder.continuationToken(continuationToken);
            }
            ListObjectsV2Response page;
            try {
                page = client.listObjectsV2(builder.build());
            } catch (SdkException e) {
                throw new RasterSourceException("Failed to list s3://" + bucket + "/" + nullToEmpty(prefix)
                        + ": " + e.getMessage(), e);
            }
            pages++;
            for (S3Object object : page.contents()) {
                keys.add(object.key());
            }
            continuationToken = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
        } while (continuationToken != null);
        logger.debug("Listed {} key(s) in {} page(s) under s3://{}/{}", keys.size(), pages, bucket, nullToEmpty(prefix));
        return keys;
    }

    /**
     * Last path segment without its extension.
     */
    static String fileName(String key) {
        String name = key.substring(key.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(0, dot) : name;
    }

    /**
     * Timestamp segment of {@code key}, or null when the key carries the all-zero marker or none at all.
     */
    private static String timestamp(String key, AssemblyRun run) {
        Matcher matcher = KEY_TIMESTAMP.matcher(key);
        if (!matcher.find()) {
            run.report(AssemblyDiagnostic.Kind.MISSING_TIMESTAMP, key,
                    "Key has no yyyy/mm/dd/HH/MM/SS segment; treating its bands as untimed");
            return null;
        }
        String timestamp = matcher.group();
        return NO_TIME.equals(timestamp) ? null : timestamp;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
