package com.cecil.assembler.service;

import com.cecil.assembler.dto.BandDescriptor;
import com.cecil.assembler.dto.DataRequestMetadata;
import com.cecil.assembler.dto.FileDescriptor;
import com.cecil.assembler.dto.ObjectStoreRequest;
import com.cecil.assembler.model.AssembledDataset;
import com.cecil.assembler.model.AssemblyDiagnostic;
import com.cecil.assembler.model.AssemblyOptions;
import com.cecil.assembler.model.GriddedArray;
import com.cecil.assembler.model.MixedTimePolicy;
import com.cecil.assembler.model.RasterHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point of the assembler: turns resolved request metadata into one {@link AssembledDataset}.
 * <p>
 * A run locates its files, opens their headers in parallel, merges each variable's bands, combines the
 * variables and attaches provenance. Pixels stay unread until the caller materializes an array; the returned
 * dataset should be closed once the caller is done with it.
 */
@Service
public class RasterDatasetAssembler {

    private static final Logger logger = LoggerFactory.getLogger(RasterDatasetAssembler.class);

    private final ObjectStoreFileLocator objectStoreFileLocator;
    private final ObjectStoreClientFactory clientFactory;
    private final BandReader bandReader;
    private final VariableMerger variableMerger;
    private final DatasetCombiner datasetCombiner;
    private final AttributeBinder attributeBinder;
    private final TaskExecutor taskExecutor;
    private final AssemblyOptions defaultOptions;

    public RasterDatasetAssembler(ObjectStoreFileLocator objectStoreFileLocator,
                                  ObjectStoreClientFactory clientFactory,
                                  BandReader bandReader,
                                  VariableMerger variableMerger,
                                  DatasetCombiner datasetCombiner,
                                  AttributeBinder attributeBinder,
                                  @Qualifier("rasterLoadExecutor") TaskExecutor taskExecutor,
                                  @Value("${assembler.retry.max-attempts:5}") int maxAttempts,
                                  @Value("${assembler.retry.initial-delay-ms:1000}") long initialDelayMs,
                                  @Value("${assembler.retry.multiplier:2.0}") double multiplier,
                                  @Value("${assembler.mixed-time-policy:EXPAND_WITH_SENTINEL}") MixedTimePolicy mixedTimePolicy,
                                  @Value("${assembler.skip-unreadable-files:false}") boolean skipUnreadableFiles,
                                  @Value("${assembler.object-store.verify-geometry:true}") boolean verifyGeometry) {
        this.objectStoreFileLocator = objectStoreFileLocator;
        this.clientFactory = clientFactory;
        this.bandReader = bandReader;
        this.variableMerger = variableMerger;
        this.datasetCombiner = datasetCombiner;
        this.attributeBinder = attributeBinder;
        this.taskExecutor = taskExecutor;
        this.defaultOptions = AssemblyOptions.builder()
                .maxAttempts(maxAttempts)
                .initialDelay(Duration.ofMillis(initialDelayMs))
                .backoffMultiplier(multiplier)
                .mixedTimePolicy(mixedTimePolicy)
                .skipUnreadableFiles(skipUnreadableFiles)
                .verifyObjectStoreGeometry(verifyGeometry)
                .build();
    }

    public AssemblyOptions getDefaultOptions() {
        return defaultOptions;
    }

    public AssembledDataset assemble(DataRequestMetadata metadata) {
        return assemble(metadata, defaultOptions, CancellationSignal.none());
    }

    /**
     * Assembles a request whose files are addressed by URL.
     */
    public AssembledDataset assemble(DataRequestMetadata metadata, AssemblyOptions options, CancellationSignal cancellation) {
        RequestMetadataReader.validate(metadata);
        AssemblyRun run = new AssemblyRun(metadata.dataRequestId(), options, cancellation, null, clientFactory);
        try {
            logger.info("[{}] Assembling {} file(s) of dataset {}", run.getRequestId(), metadata.files().size(), metadata.datasetId());
            Map<String, RasterHeader> headers = openAll(metadata.files(), run);
            Map<String, GriddedArray> combined = mergeAndCombine(metadata.files(), headers, run);
            AssembledDataset dataset = attributeBinder.bind(combined, metadata, run);
            logFinished(run, dataset);
            return dataset;
        } catch (RuntimeException e) {
            run.close();
            throw e;
        }
    }

    public AssembledDataset assemble(ObjectStoreRequest request) {
        return assemble(request, defaultOptions, CancellationSignal.none());
    }

    /**
     * Assembles a request whose files live under an object-store prefix, using the request's temporary
     * credentials for this run only. The first mapped file's grid is authoritative for the request.
     *
     * @throws GridGeometryMismatchException if geometry verification is on and a file's grid differs
     */
    public AssembledDataset assemble(ObjectStoreRequest request, AssemblyOptions options, CancellationSignal cancellation) {
        RequestMetadataReader.validate(request);
        AssemblyRun run = new AssemblyRun(request.dataRequestId(), options, cancellation, request.credentials(), clientFactory);
        try {
            List<FileDescriptor> files = objectStoreFileLocator.locate(request, run);
            if (files.isEmpty()) {
                throw new NoAssemblableDataException("No mapped raster file under s3://" + request.bucket().name()
                        + "/" + (request.bucket().prefix() == null ? "" : request.bucket().prefix()));
            }
            Map<String, RasterHeader> headers = options.isVerifyObjectStoreGeometry()
                    ? verifyUniformGeometry(files, openAll(files, run))
                    : shareFirstHeader(files, run);
            RasterHeader authoritative = headers.values().iterator().next();
            Map<String, GriddedArray> combined = mergeAndCombine(files, headers, run);
            AssembledDataset dataset = attributeBinder.bind(combined, request, authoritative.geometry().crs(), run);
            logFinished(run, dataset);
            return dataset;
        } catch (RuntimeException e) {
            run.close();
            throw e;
        }
    }

    private Map<String, GriddedArray> mergeAndCombine(List<FileDescriptor> files,
                                                      Map<String, RasterHeader> headers,
                                                      AssemblyRun run) {
        Map<String, List<BandRef>> byVariable = new LinkedHashMap<>();
        for (FileDescriptor file : files) {
            for (BandDescriptor band : file.bands()) {
                byVariable.computeIfAbsent(band.variableName(), v -> new ArrayList<>()).add(new BandRef(file.url(), band));
            }
        }

        Map<String, GriddedArray> merged = new LinkedHashMap<>();
        for (Map.Entry<String, List<BandRef>> entry : byVariable.entrySet()) {
            run.checkCancelled("merging " + entry.getKey());
            Optional<GriddedArray> array = variableMerger.merge(entry.getKey(), entry.getValue(), headers, run);
            array.ifPresent(a -> merged.put(entry.getKey(), a));
        }

        run.checkCancelled("combining variables");
        return datasetCombiner.combine(merged, run);
    }

    /**
     * Opens every distinct file header on the load executor. Results are collected in file order so that
     * diagnostics and the first readable file do not depend on scheduling.
     *
     * @return headers by location, in file order; unreadable files are absent when the run skips them
     */
    Map<String, RasterHeader> openAll(List<FileDescriptor> files, AssemblyRun run) {
        Set<String> locations = new LinkedHashSet<>();
        for (FileDescriptor file : files) {
            locations.add(file.url());
        }

        Map<String, CompletableFuture<RasterHeader>> pending = new LinkedHashMap<>();
        for (String location : locations) {
            run.checkCancelled("loading " + location);
            pending.put(location, CompletableFuture.supplyAsync(() -> {
                try {
                    return bandReader.open(location, run);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, taskExecutor));
        }

        Map<String, RasterHeader> headers = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, CompletableFuture<RasterHeader>> entry : pending.entrySet()) {
                try {
                    headers.put(entry.getKey(), entry.getValue().join());
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() instanceof UncheckedIOException ? e.getCause().getCause() : e.getCause();
                    handleUnreadable(entry.getKey(), cause, run);
                }
            }
        } catch (RuntimeException | Error e) {
            cancelPending(pending, run);
            throw e;
        }
        if (headers.isEmpty()) {
            throw new NoAssemblableDataException("None of " + locations.size() + " file(s) could be opened for request "
                    + run.getRequestId());
        }
        return headers;
    }

    /**
     * Aborts the run so loads already on the executor stop at their next attempt, and cancels the loads
     * that have not finished.
     */
    private void cancelPending(Map<String, CompletableFuture<RasterHeader>> pending, AssemblyRun run) {
        run.abort();
        int cancelled = 0;
        for (CompletableFuture<RasterHeader> future : pending.values()) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            logger.info("[{}] Cancelled {} pending file load(s) after a failed load", run.getRequestId(), cancelled);
        }
    }

    private void handleUnreadable(String location, Throwable cause, AssemblyRun run) {
        boolean fatal = cause instanceof AssemblyException && !(cause instanceof RasterSourceException);
        if (run.getOptions().isSkipUnreadableFiles() && !fatal) {
            run.report(AssemblyDiagnostic.Kind.UNREADABLE_FILE, location, "Skipped after retries: " + cause);
            return;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new RasterSourceException("Failed to load file " + location + ": " + cause.getMessage(), cause);
    }

    private Map<String, RasterHeader> verifyUniformGeometry(List<FileDescriptor> files, Map<String, RasterHeader> headers) {
        RasterHeader authoritative = headers.values().iterator().next();
        for (RasterHeader header : headers.values()) {
            if (!authoritative.geometry().equals(header.geometry())) {
                throw new GridGeometryMismatchException("Grid of " + header.location() + " ("
                        + header.geometry().describe() + ") differs from the request grid of "
                        + authoritative.location() + " (" + authoritative.geometry().describe() + ")");
            }
        }
        logger.debug("Verified grid {} across {} of {} file(s)", authoritative.geometry().describe(), headers.size(), files.size());
        return headers;
    }

    /**
     * Opens only the first file and lends its header to every other file, without checking them.
     */
    private Map<String, RasterHeader> shareFirstHeader(List<FileDescriptor> files, AssemblyRun run) {
        RasterHeader first = openAll(files.subList(0, 1), run).values().iterator().next();
        Map<String, RasterHeader> headers = new LinkedHashMap<>();
        for (FileDescriptor file : files) {
            headers.put(file.url(), new RasterHeader(file.url(), first.bandCount(), first.geometry(), first.dtype(), first.nodata()));
        }
        logger.warn("[{}] Grid verification disabled; using {} for all {} file(s)",
                run.getRequestId(), first.geometry().describe(), files.size());
        return headers;
    }

    private void logFinished(AssemblyRun run, AssembledDataset dataset) {
        logger.info("[{}] Assembled {} variable(s) {} with {} diagnostic(s)",
                run.getRequestId(), dataset.variables().size(), dataset.variableNames(), dataset.diagnostics().size());
    }
}
