package com.cecil.assembler.model;

import java.util.List;

public enum AxisLayout {
    SPATIAL(List.of(GriddedArray.Y, GriddedArray.X)),
    SPATIOTEMPORAL(List.of(GriddedArray.TIME, GriddedArray.Y, GriddedArray.X));

    private final List<String> dims;

    AxisLayout(List<String> dims) {
        this.dims = dims;
    }

    public List<String> dims() {
        return dims;
    }
}
