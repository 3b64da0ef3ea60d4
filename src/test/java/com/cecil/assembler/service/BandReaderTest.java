package com.cecil.assembler.service;

import com.cecil.assembler.model.AssemblyOptions;
import com.cecil.assembler.model.GridGeometry;
import com.cecil.assembler.model.GriddedArray;
import com.cecil.assembler.model.RasterHeader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BandReaderTest {

    private static final GridGeometry GRID = GridGeometry.fromAffine(4, 3, 10.0, 50.0, 0.5, 0.5, "EPSG:4326");

    private InMemoryRasterSource source;
    private BandReader bandReader;
    private AssemblyRun run;

    @BeforeEach
    void setUp() {
        source = new InMemoryRasterSource().file("mem://a.tif", GRID, 1.0, 2.0, 3.0);
        bandReader = new BandReader(source, new RetryExecutor(delay -> { }), null);
        run = new AssemblyRun("req-1", AssemblyOptions.builder().maxAttempts(3).initialDelay(Duration.ZERO).build(),
                CancellationSignal.none(), null, null);
    }

    @Test
    void readReturnsLazySpatialPlane() throws IOException {
        GriddedArray array = bandReader.read("mem://a.tif", 2, "ndvi", run);

        assertThat(array.name()).isEqualTo("ndvi");
        assertThat(array.dims()).containsExactly("y", "x");
        assertThat(array.shape()).containsExactly(4, 3);
        assertThat(array.isMaterialized()).isFalse();
        assertThat(source.bandReads()).isZero();

        assertThat(array.materialize()).containsOnly(2.0);
        assertThat(array.isMaterialized()).isTrue();
        assertThat(source.bandReads()).isEqualTo(1);
    }

    @Test
    void bandOutOfRangeFailsWithoutRetry() {
        assertThatThrownBy(() -> bandReader.read("mem://a.tif", 4, "ndvi", run))
                .isInstanceOf(BandOutOfRangeException.class)
                .satisfies(e -> {
                    BandOutOfRangeException out = (BandOutOfRangeException) e;
                    assertThat(out.getBandNumber()).isEqualTo(4);
                    assertThat(out.getBandCount()).isEqualTo(3);
                });
        assertThat(source.opens("mem://a.tif")).isEqualTo(1);
    }

    @Test
    void bandZeroIsOutOfRange() throws IOException {
        RasterHeader header = bandReader.open("mem://a.tif", run);

        assertThatThrownBy(() -> bandReader.plane(header, 0, "ndvi", null, null, run))
                .isInstanceOf(BandOutOfRangeException.class);
    }

    @Test
    void transientOpenFailuresAreRetried() throws IOException {
        source.failOpen("mem://a.tif", 2);

        RasterHeader header = bandReader.open("mem://a.tif", run);

        assertThat(header.bandCount()).isEqualTo(3);
        assertThat(source.opens("mem://a.tif")).isEqualTo(3);
    }

    @Test
    void exhaustedRetriesSurfaceTheIoFailure() {
        source.failOpen("mem://a.tif", 5);

        assertThatThrownBy(() -> bandReader.open("mem://a.tif", run))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Connection reset");
        assertThat(source.opens("mem://a.tif")).isEqualTo(3);
    }

    @Test
    void declaredDtypeAndNodataOverrideTheFile() throws IOException {
        RasterHeader header = bandReader.open("mem://a.tif", run);

        GriddedArray declared = bandReader.plane(header, 1, "elev", "int16", 0.0, run);
        GriddedArray inherited = bandReader.plane(header, 1, "elev", null, null, run);

        assertThat(declared.dtype()).isEqualTo("int16");
        assertThat(declared.nodata()).isEqualTo(0.0);
        assertThat(inherited.dtype()).isEqualTo("float32");
        assertThat(inherited.nodata()).isEqualTo(-9999.0);
    }

    @Test
    void cancelledRunDoesNotOpen() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AssemblyRun cancelled = new AssemblyRun("req-2", AssemblyOptions.builder().build(), signal, null, null);

        assertThatThrownBy(() -> bandReader.open("mem://a.tif", cancelled))
                .isInstanceOf(AssemblyCancelledException.class);
        assertThat(source.opens("mem://a.tif")).isZero();
    }

    @Test
    void onlySourceFailuresAmongAssemblyErrorsAreTransient() {
        assertThat(BandReader.isTransient(new IOException("reset"))).isTrue();
        assertThat(BandReader.isTransient(new RasterSourceException("503"))).isTrue();
        assertThat(BandReader.isTransient(new BandOutOfRangeException("a", 9, 1))).isFalse();
        assertThat(BandReader.isTransient(new AssemblyCancelledException("stop"))).isFalse();
        assertThat(BandReader.isTransient(new IllegalArgumentException("bad"))).isFalse();
    }
}
