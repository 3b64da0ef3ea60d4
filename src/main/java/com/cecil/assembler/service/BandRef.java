package com.cecil.assembler.service;

import com.cecil.assembler.dto.BandDescriptor;

/**
 * A band of one file, as gathered for its variable.
 */
public record BandRef(String location, BandDescriptor band) {}
