package com.cecil.assembler.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declared band layout of every object sharing a file name: band {@code i} (1-based) holds {@code bands[i-1]}.
 */
public record FileLayout(
        @JsonProperty("bands") List<String> bands,
        @JsonProperty("dtype") @JsonAlias("type") String dtype
) {
    public FileLayout {
        bands = bands == null ? List.of() : List.copyOf(bands);
    }
}
