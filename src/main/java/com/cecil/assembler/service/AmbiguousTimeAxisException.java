package com.cecil.assembler.service;

/**
 * A variable mixes timed and untimed planes and the configured policy rejects that.
 */
public class AmbiguousTimeAxisException extends AssemblyException {
    public AmbiguousTimeAxisException(String m) { super(m); }
    public AmbiguousTimeAxisException(String m, Throwable c) { super(m, c); }
}
