package com.cecil.assembler.service;

/**
 * A raster source could not be opened or read. Treated as transient by the retry wrapper.
 */
public class RasterSourceException extends AssemblyException {
    public RasterSourceException(String m) { super(m); }
    public RasterSourceException(String m, Throwable c) { super(m, c); }
}
