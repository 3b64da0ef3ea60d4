package com.cecil.assembler.service;

/**
 * Root of the unchecked errors raised while assembling a raster dataset.
 */
public class AssemblyException extends RuntimeException {
    /**
     * Creates an exception describing an unrecoverable assembly condition.
     */
    public AssemblyException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public AssemblyException(String m, Throwable c) { super(m, c); }
}
