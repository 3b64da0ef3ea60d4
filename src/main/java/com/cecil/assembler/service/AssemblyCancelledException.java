package com.cecil.assembler.service;

public class AssemblyCancelledException extends AssemblyException {
    public AssemblyCancelledException(String m) { super(m); }
    public AssemblyCancelledException(String m, Throwable c) { super(m, c); }
}
