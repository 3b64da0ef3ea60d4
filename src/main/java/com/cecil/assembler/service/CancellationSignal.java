package com.cecil.assembler.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation of an assembly run. Checked between file loads and before the merge,
 * concatenation and combine steps.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String stage) {
        if (cancelled.get()) {
            throw new AssemblyCancelledException("Assembly cancelled before " + stage);
        }
    }
}
