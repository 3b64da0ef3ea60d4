package com.cecil.assembler.service;

import com.cecil.assembler.model.RasterHeader;

import java.io.IOException;

/**
 * Access to multi-band raster files. Opening reads only the header; pixels are read per band on demand.
 */
public interface RasterSource {

    RasterHeader open(String location, AssemblyRun run) throws IOException;

    /**
     * Reads band {@code bandNumber} (1-based) as row-major values of {@code header}'s grid.
     */
    double[] readBand(RasterHeader header, int bandNumber, AssemblyRun run) throws IOException;
}
