package com.cecil.assembler.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Per-run tuning of an assembly. Defaults come from application properties.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class AssemblyOptions {

    @Builder.Default
    private final int maxAttempts = 5;

    @Builder.Default
    private final Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    private final double backoffMultiplier = 2.0;

    @Builder.Default
    private final MixedTimePolicy mixedTimePolicy = MixedTimePolicy.EXPAND_WITH_SENTINEL;

    // Skip files whose open keeps failing instead of failing the run
    private final boolean skipUnreadableFiles;

    @Builder.Default
    private final boolean verifyObjectStoreGeometry = true;
}
