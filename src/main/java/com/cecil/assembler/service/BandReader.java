package com.cecil.assembler.service;

import com.cecil.assembler.model.AssemblyOptions;
import com.cecil.assembler.model.GriddedArray;
import com.cecil.assembler.model.LazyPlane;
import com.cecil.assembler.model.RasterHeader;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Exposes single bands of raster files as lazily-read spatial planes.
 * <p>
 * Opening a file is retried with the run's backoff settings. A band number outside the file's range is a
 * contract violation and fails immediately. Pixels are read, again with retries, only when a plane is
 * materialized.
 */
@Service
public class BandReader {

    private static final Logger logger = LoggerFactory.getLogger(BandReader.class);

    private final RasterSource rasterSource;
    private final RetryExecutor retryExecutor;
    private final RateLimiter openRateLimiter;

    @SuppressWarnings("UnstableApiUsage")
    public BandReader(RasterSource rasterSource,
                      RetryExecutor retryExecutor,
                      @Qualifier("rasterOpenRateLimiter") RateLimiter openRateLimiter) {
        this.rasterSource = rasterSource;
        this.retryExecutor = retryExecutor;
        this.openRateLimiter = openRateLimiter;
    }

    /**
     * Opens the header of {@code location}, retrying transient failures.
     */
    public RasterHeader open(String location, AssemblyRun run) throws IOException {
        AssemblyOptions options = run.getOptions();
        return retryExecutor.execute(() -> {
                    run.checkCancelled("loading " + location);
                    throttle();
                    return rasterSource.open(location, run);
                },
                options.getMaxAttempts(),
                options.getInitialDelay(),
                options.getBackoffMultiplier(),
                BandReader::isTransient);
    }

    /**
     * Opens {@code location} and returns band {@code bandNumber} as a spatial array named {@code variableName}.
     */
    public GriddedArray read(String location, int bandNumber, String variableName, AssemblyRun run) throws IOException {
        return plane(open(location, run), bandNumber, variableName, null, null, run);
    }

    /**
     * Band {@code bandNumber} of an already opened file. Declared dtype/no-data override the file's own.
     *
     * @throws BandOutOfRangeException if the file has no such band
     */
    public GriddedArray plane(RasterHeader header,
                              int bandNumber,
                              String variableName,
                              String declaredDtype,
                              Double declaredNodata,
                              AssemblyRun run) {
        if (bandNumber < 1 || bandNumber > header.bandCount()) {
            throw new BandOutOfRangeException(header.location(), bandNumber, header.bandCount());
        }
        AssemblyOptions options = run.getOptions();
        LazyPlane plane = LazyPlane.deferred(header.geometry().height(), header.geometry().width(), () -> {
            logger.debug("Reading band {} of {} for {}", bandNumber, header.location(), variableName);
            try {
                return retryExecutor.execute(() -> rasterSource.readBand(header, bandNumber, run),
                        options.getMaxAttempts(),
                        options.getInitialDelay(),
                        options.getBackoffMultiplier(),
                        BandReader::isTransient);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read band " + bandNumber + " of " + header.location(), e);
            }
        });
        return GriddedArray.spatial(variableName,
                header.geometry(),
                plane,
                declaredDtype != null ? declaredDtype : header.dtype(),
                declaredNodata != null ? declaredNodata : header.nodata());
    }

    @SuppressWarnings("UnstableApiUsage")
    private void throttle() {
        if (openRateLimiter != null) {
            openRateLimiter.acquire();
        }
    }

    /**
     * I/O and source failures are worth another attempt; contract violations are not.
     */
    static boolean isTransient(Exception e) {
        if (e instanceof AssemblyException) {
            return e instanceof RasterSourceException;
        }
        return !(e instanceof IllegalArgumentException);
    }
}
