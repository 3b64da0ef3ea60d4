package com.cecil.assembler.service;

public class NoAssemblableDataException extends AssemblyException {
    public NoAssemblableDataException(String m) { super(m); }
    public NoAssemblableDataException(String m, Throwable c) { super(m, c); }
}
