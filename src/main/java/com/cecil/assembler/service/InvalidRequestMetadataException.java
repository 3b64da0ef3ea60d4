package com.cecil.assembler.service;

public class InvalidRequestMetadataException extends AssemblyException {
    public InvalidRequestMetadataException(String m) { super(m); }
    public InvalidRequestMetadataException(String m, Throwable c) { super(m, c); }
}
