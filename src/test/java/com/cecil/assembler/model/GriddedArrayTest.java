package com.cecil.assembler.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class GriddedArrayTest {

    private static final GridGeometry GRID = GridGeometry.fromAffine(2, 3, 100.0, 200.0, 10.0, 10.0, "EPSG:3857");

    @Test
    void affineGridUsesPixelCentres() {
        assertThat(GRID.x()).containsExactly(105.0, 115.0, 125.0);
        assertThat(GRID.y()).containsExactly(195.0, 185.0);
        assertThat(GRID.describe()).isEqualTo("y:2,x:3 (EPSG:3857)");
    }

    @Test
    void deferredPlaneIsReadOnceOnDemand() {
        AtomicInteger reads = new AtomicInteger();
        LazyPlane plane = LazyPlane.deferred(2, 3, () -> {
            reads.incrementAndGet();
            return new double[]{1, 2, 3, 4, 5, 6};
        });

        assertThat(plane.isMaterialized()).isFalse();
        assertThat(plane.valueAt(1, 2)).isEqualTo(6.0);
        assertThat(plane.materialize()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(plane.isMaterialized()).isTrue();
        assertThat(reads.get()).isEqualTo(1);
    }

    @Test
    void planeOfTheWrongSizeFailsWhenRead() {
        LazyPlane plane = LazyPlane.deferred(2, 3, () -> new double[4]);

        assertThatThrownBy(plane::materialize).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void addingTimeAxisGivesLengthOneStack() {
        GriddedArray spatial = GriddedArray.spatial("ndvi", GRID, LazyPlane.of(2, 3, new double[6]), "float32", null);

        GriddedArray timed = spatial.withTimeAxis(Instant.parse("2024-05-01T00:00:00Z"));

        assertThat(spatial.layout()).isEqualTo(AxisLayout.SPATIAL);
        assertThat(timed.layout()).isEqualTo(AxisLayout.SPATIOTEMPORAL);
        assertThat(timed.sizes()).containsExactly(
                entry("time", 1),
                entry("y", 2),
                entry("x", 3));
        assertThatThrownBy(() -> timed.withTimeAxis(Instant.EPOCH)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stackFlattensInTimeOrder() {
        GriddedArray stack = GriddedArray.stacked("t", GRID,
                List.of(Instant.EPOCH, Instant.parse("2000-01-01T00:00:00Z")),
                List.of(LazyPlane.of(2, 3, new double[]{1, 1, 1, 1, 1, 1}), LazyPlane.of(2, 3, new double[]{2, 2, 2, 2, 2, 2})),
                "float64", -1.0);

        double[] values = stack.materialize();

        assertThat(values).hasSize(12);
        assertThat(values[5]).isEqualTo(1.0);
        assertThat(values[6]).isEqualTo(2.0);
    }

    @Test
    void stackNeedsOnePlanePerTime() {
        assertThatThrownBy(() -> GriddedArray.stacked("t", GRID, List.of(Instant.EPOCH), List.of(), "float32", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void planeMustFitTheGrid() {
        assertThatThrownBy(() -> GriddedArray.spatial("bad", GRID, LazyPlane.of(3, 2, new double[6]), "float32", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
