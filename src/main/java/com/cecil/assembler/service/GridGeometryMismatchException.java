package com.cecil.assembler.service;

/**
 * An object-store file's grid differs from the authoritative grid of its request.
 */
public class GridGeometryMismatchException extends AssemblyException {
    public GridGeometryMismatchException(String m) { super(m); }
    public GridGeometryMismatchException(String m, Throwable c) { super(m, c); }
}
