package com.cecil.assembler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FileDescriptor(
        @JsonProperty("url") String url,
        @JsonProperty("bands") List<BandDescriptor> bands
) {
    public FileDescriptor {
        bands = bands == null ? List.of() : List.copyOf(bands);
    }
}
