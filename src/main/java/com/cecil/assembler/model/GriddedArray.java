package com.cecil.assembler.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lazily-materialized array of one variable, either a single spatial plane {@code (y, x)} or a stack of
 * planes along time {@code (time, y, x)}. Instances are immutable; every transformation returns a new one.
 */
public final class GriddedArray {

    public static final String TIME = "time";
    public static final String Y = "y";
    public static final String X = "x";

    private final String name;
    private final AxisLayout layout;
    private final GridGeometry geometry;
    private final List<Instant> times;
    private final List<LazyPlane> planes;
    private final String dtype;
    private final Double nodata;

    private GriddedArray(String name,
                         AxisLayout layout,
                         GridGeometry geometry,
                         List<Instant> times,
                         List<LazyPlane> planes,
                         String dtype,
                         Double nodata) {
        this.name = name;
        this.layout = layout;
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.times = Collections.unmodifiableList(new ArrayList<>(times));
        this.planes = Collections.unmodifiableList(new ArrayList<>(planes));
        this.dtype = dtype;
        this.nodata = nodata;
        for (LazyPlane plane : this.planes) {
            if (plane.height() != geometry.height() || plane.width() != geometry.width()) {
                throw new IllegalArgumentException("Plane " + plane.height() + "x" + plane.width()
                        + " does not fit grid " + geometry.describe());
            }
        }
    }

    public static GriddedArray spatial(String name, GridGeometry geometry, LazyPlane plane, String dtype, Double nodata) {
        return new GriddedArray(name, AxisLayout.SPATIAL, geometry, List.of(), List.of(plane), dtype, nodata);
    }

    /**
     * Builds a time stack. Callers are responsible for the planes sharing {@code geometry}.
     */
    public static GriddedArray stacked(String name,
                                       GridGeometry geometry,
                                       List<Instant> times,
                                       List<LazyPlane> planes,
                                       String dtype,
                                       Double nodata) {
        if (times.isEmpty() || times.size() != planes.size()) {
            throw new IllegalArgumentException("Time stack needs one plane per time coordinate, got "
                    + times.size() + " times and " + planes.size() + " planes");
        }
        return new GriddedArray(name, AxisLayout.SPATIOTEMPORAL, geometry, times, planes, dtype, nodata);
    }

    /**
     * Adds a length-1 time axis at {@code time} to a spatial plane.
     */
    public GriddedArray withTimeAxis(Instant time) {
        if (layout != AxisLayout.SPATIAL) {
            throw new IllegalStateException("Variable " + name + " already has a time axis");
        }
        return stacked(name, geometry, List.of(time), planes, dtype, nodata);
    }

    public String name() {
        return name;
    }

    public AxisLayout layout() {
        return layout;
    }

    public boolean hasTimeAxis() {
        return layout == AxisLayout.SPATIOTEMPORAL;
    }

    public GridGeometry geometry() {
        return geometry;
    }

    public List<String> dims() {
        return layout.dims();
    }

    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        if (hasTimeAxis()) {
            sizes.put(TIME, times.size());
        }
        sizes.put(Y, geometry.height());
        sizes.put(X, geometry.width());
        return Collections.unmodifiableMap(sizes);
    }

    public int[] shape() {
        return sizes().values().stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Time coordinates, empty for a spatial array.
     */
    public List<Instant> times() {
        return times;
    }

    public List<LazyPlane> planes() {
        return planes;
    }

    public String dtype() {
        return dtype;
    }

    public Double nodata() {
        return nodata;
    }

    public boolean isMaterialized() {
        return planes.stream().allMatch(LazyPlane::isMaterialized);
    }

    /**
     * Forces every plane and returns the values flattened in {@link #dims()} order.
     */
    public double[] materialize() {
        int planeSize = geometry.height() * geometry.width();
        double[] out = new double[planeSize * planes.size()];
        for (int t = 0; t < planes.size(); t++) {
            System.arraycopy(planes.get(t).materialize(), 0, out, t * planeSize, planeSize);
        }
        return out;
    }

    @Override
    public String toString() {
        return "GriddedArray[" + name + " " + sizes() + "]";
    }
}
