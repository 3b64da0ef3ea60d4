package com.cecil.assembler.service;

/**
 * Two variables declare the same spatial axis with different coordinate values.
 */
public class CombineIncompatibleException extends AssemblyException {
    public CombineIncompatibleException(String m) { super(m); }
    public CombineIncompatibleException(String m, Throwable c) { super(m, c); }
}
