package com.cecil.assembler.service;

/**
 * A band carried an explicit time pattern that its raw time string does not match.
 */
public class TimeParseException extends AssemblyException {
    public TimeParseException(String m) { super(m); }
    public TimeParseException(String m, Throwable c) { super(m, c); }
}
