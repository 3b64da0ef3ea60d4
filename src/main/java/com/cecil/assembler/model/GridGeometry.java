package com.cecil.assembler.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Spatial grid of a raster plane: pixel-centre coordinates along {@code y} and {@code x} plus the CRS.
 * Two geometries are equal only when every coordinate value and the CRS match exactly.
 */
public final class GridGeometry {

    private final double[] y;
    private final double[] x;
    private final String crs;

    public GridGeometry(double[] y, double[] x, String crs) {
        Objects.requireNonNull(y, "y");
        Objects.requireNonNull(x, "x");
        if (y.length == 0 || x.length == 0) {
            throw new IllegalArgumentException("Grid must have at least one row and one column");
        }
        this.y = y.clone();
        this.x = x.clone();
        this.crs = crs;
    }

    /**
     * Builds a north-up grid from an origin corner and pixel size, using pixel centres.
     */
    public static GridGeometry fromAffine(int height, int width,
                                          double originX, double originY,
                                          double pixelWidth, double pixelHeight,
                                          String crs) {
        double[] ys = new double[height];
        double[] xs = new double[width];
        for (int row = 0; row < height; row++) {
            ys[row] = originY - (row + 0.5) * pixelHeight;
        }
        for (int col = 0; col < width; col++) {
            xs[col] = originX + (col + 0.5) * pixelWidth;
        }
        return new GridGeometry(ys, xs, crs);
    }

    /**
     * Grid addressed by pixel index, for sources without georeferencing.
     */
    public static GridGeometry indexed(int height, int width, String crs) {
        double[] ys = new double[height];
        double[] xs = new double[width];
        for (int row = 0; row < height; row++) {
            ys[row] = row;
        }
        for (int col = 0; col < width; col++) {
            xs[col] = col;
        }
        return new GridGeometry(ys, xs, crs);
    }

    public int height() {
        return y.length;
    }

    public int width() {
        return x.length;
    }

    public double[] y() {
        return y.clone();
    }

    public double[] x() {
        return x.clone();
    }

    public String crs() {
        return crs;
    }

    public boolean sameYAxis(GridGeometry other) {
        return Arrays.equals(y, other.y);
    }

    public boolean sameXAxis(GridGeometry other) {
        return Arrays.equals(x, other.x);
    }

    public String describe() {
        return "y:" + height() + ",x:" + width() + (crs != null ? " (" + crs + ")" : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridGeometry)) return false;
        GridGeometry that = (GridGeometry) o;
        return Arrays.equals(y, that.y) && Arrays.equals(x, that.x) && Objects.equals(crs, that.crs);
    }

    @Override
    public int hashCode() {
        int result = Objects.hashCode(crs);
        result = 31 * result + Arrays.hashCode(y);
        result = 31 * result + Arrays.hashCode(x);
        return result;
    }

    @Override
    public String toString() {
        return "GridGeometry[" + describe() + "]";
    }
}
