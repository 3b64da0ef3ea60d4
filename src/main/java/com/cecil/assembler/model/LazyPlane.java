package com.cecil.assembler.model;

import com.google.common.base.Suppliers;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Deferred 2-D pixel plane. The read function runs at most once, the first time values are requested;
 * values are row-major, {@code height * width} long.
 */
public final class LazyPlane {

    private final int height;
    private final int width;
    private final AtomicBoolean materialized = new AtomicBoolean(false);
    private final Supplier<double[]> values;

    private LazyPlane(int height, int width, Supplier<double[]> reader) {
        this.height = height;
        this.width = width;
        this.values = Suppliers.memoize(() -> {
            double[] read = reader.get();
            if (read == null || read.length != height * width) {
                throw new IllegalStateException("Plane read returned " + (read == null ? "null" : read.length + " values")
                        + ", expected " + height + "x" + width);
            }
            materialized.set(true);
            return read;
        });
    }

    public static LazyPlane deferred(int height, int width, Supplier<double[]> reader) {
        return new LazyPlane(height, width, reader);
    }

    public static LazyPlane of(int height, int width, double[] values) {
        double[] copy = values.clone();
        return new LazyPlane(height, width, () -> copy);
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public boolean isMaterialized() {
        return materialized.get();
    }

    /**
     * Forces the read and returns a copy of the plane's values.
     */
    public double[] materialize() {
        return values.get().clone();
    }

    public double valueAt(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("(" + row + "," + col + ") outside " + height + "x" + width);
        }
        return values.get()[row * width + col];
    }
}
