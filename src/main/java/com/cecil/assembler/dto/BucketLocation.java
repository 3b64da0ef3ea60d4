package com.cecil.assembler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BucketLocation(
        @JsonProperty("name") String name,
        @JsonProperty("prefix") String prefix
) {}
