package com.cecil.assembler.service;

import com.cecil.assembler.dto.TemporaryCredentials;
import com.cecil.assembler.model.AssemblyDiagnostic;
import com.cecil.assembler.model.AssemblyOptions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * State of one assembly run: its options, cancellation signal, object-store access and the diagnostics
 * gathered so far. Nothing here is shared between runs.
 */
public class AssemblyRun implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AssemblyRun.class);

    private final String requestId;
    private final AssemblyOptions options;
    private final CancellationSignal cancellation;
    private final TemporaryCredentials credentials;
    private final ObjectStoreClientFactory clientFactory;

    private final List<AssemblyDiagnostic> diagnostics = new ArrayList<>();
    private final List<AutoCloseable> resources = new ArrayList<>();
    // soft values: the JVM may drop a cached file under memory pressure and it is fetched again
    private final Cache<String, byte[]> fileBytes = CacheBuilder.newBuilder().softValues().build();
    private S3Client objectStoreClient;
    private volatile boolean aborted;

    public AssemblyRun(String requestId,
                       AssemblyOptions options,
                       CancellationSignal cancellation,
                       TemporaryCredentials credentials,
                       ObjectStoreClientFactory clientFactory) {
        this.requestId = requestId;
        this.options = options;
        this.cancellation = cancellation != null ? cancellation : CancellationSignal.none();
        this.credentials = credentials;
        this.clientFactory = clientFactory;
        this.resources.add(fileBytes::invalidateAll);
    }

    public String getRequestId() {
        return requestId;
    }

    public AssemblyOptions getOptions() {
        return options;
    }

    /**
     * @throws AssemblyCancelledException if the caller cancelled or the run was aborted
     */
    public void checkCancelled(String stage) {
        if (aborted) {
            throw new AssemblyCancelledException("Run " + requestId + " aborted before " + stage);
        }
        cancellation.throwIfCancelled(stage);
    }

    /**
     * Stops work still in flight for a failed run; its pending loads give up at their next check.
     */
    public void abort() {
        aborted = true;
    }

    /**
     * Object-store client for this run, created on first use from the run's credentials
     * (or the default provider chain when the run has none).
     */
    public synchronized S3Client objectStoreClient() {
        if (objectStoreClient == null) {
            if (clientFactory == null) {
                throw new IllegalStateException("Run " + requestId + " has no object-store access");
            }
            objectStoreClient = credentials != null ? clientFactory.create(credentials, requestId) : clientFactory.createDefault();
            resources.add(objectStoreClient);
        }
        return objectStoreClient;
    }

    /**
     * Whole-file bytes of {@code location}, loaded once per run and shared by every band read of that file.
     * Concurrent callers for the same location wait for a single load.
     */
    public byte[] fileBytes(String location, Callable<byte[]> loader) throws IOException {
        try {
            return fileBytes.get(location, loader);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new RasterSourceException("Failed to load " + location + ": " + e.getCause().getMessage(), e.getCause());
        } catch (UncheckedExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public synchronized void report(AssemblyDiagnostic.Kind kind, String subject, String message) {
        logger.warn("[{}] {} {}: {}", requestId, kind, subject, message);
        diagnostics.add(new AssemblyDiagnostic(kind, subject, message));
    }

    public synchronized List<AssemblyDiagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * Hands the run's open resources over to the caller; the run no longer closes them.
     */
    public synchronized List<AutoCloseable> releaseResources() {
        List<AutoCloseable> handed = new ArrayList<>(resources);
        resources.clear();
        return handed;
    }

    @Override
    public synchronized void close() {
        aborted = true;
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("[{}] Failed to close {}: {}", requestId, resource, e.getMessage(), e);
            }
        }
        resources.clear();
    }
}
