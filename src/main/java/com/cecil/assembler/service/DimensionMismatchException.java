package com.cecil.assembler.service;

/**
 * Planes of one variable could not be stacked along time because their grids differ.
 */
public class DimensionMismatchException extends AssemblyException {
    public DimensionMismatchException(String m) { super(m); }
    public DimensionMismatchException(String m, Throwable c) { super(m, c); }
}
