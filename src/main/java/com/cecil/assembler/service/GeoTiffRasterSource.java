package com.cecil.assembler.service;

import com.cecil.assembler.model.GridGeometry;
import com.cecil.assembler.model.RasterHeader;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * GeoTIFF {@link RasterSource}. Bands are the samples of the first image directory; georeferencing comes
 * from ModelPixelScale + ModelTiepoint (or ModelTransformation), the CRS from the GeoKeyDirectory and
 * no-data from GDAL_NODATA.
 */
@Service
public class GeoTiffRasterSource implements RasterSource {

    private static final Logger logger = LoggerFactory.getLogger(GeoTiffRasterSource.class);

    static final int TAG_MODEL_PIXEL_SCALE = 33550;
    static final int TAG_MODEL_TIEPOINT = 33922;
    static final int TAG_MODEL_TRANSFORMATION = 34264;
    static final int TAG_GEO_KEY_DIRECTORY = 34735;
    static final int TAG_GDAL_NODATA = 42113;

    private static final int KEY_RASTER_TYPE = 1025;
    private static final int KEY_GEOGRAPHIC_TYPE = 2048;
    private static final int KEY_PROJECTED_CS_TYPE = 3072;
    private static final int RASTER_PIXEL_IS_POINT = 2;
    private static final int USER_DEFINED = 32767;

    /** Leading bytes fetched to read a header; classic TIFF writers put the first directory near the start. */
    static final int HEADER_WINDOW = 64 * 1024;
    private static final int MAX_WINDOW = Integer.MAX_VALUE - 8;

    private final RasterByteFetcher fetcher;

    public GeoTiffRasterSource(RasterByteFetcher fetcher) {
        this.fetcher = fetcher;
    }

    @Override
    public RasterHeader open(String location, AssemblyRun run) throws IOException {
        FileDirectory directory = headerDirectory(location, run);
        int width = directory.getImageWidth().intValue();
        int height = directory.getImageHeight().intValue();
        int bands = directory.getSamplesPerPixel();
        GridGeometry geometry = geometry(directory, height, width);
        RasterHeader header = new RasterHeader(location, bands, geometry, dtype(directory), nodata(directory));
        logger.debug("Opened {}: {} band(s), grid {}", location, bands, geometry.describe());
        return header;
    }

    /**
     * Decodes only the requested sample. The file itself is downloaded once per run and shared by every band
     * read of it.
     */
    @Override
    public double[] readBand(RasterHeader header, int bandNumber, AssemblyRun run) throws IOException {
        String location = header.location();
        byte[] bytes = run.fileBytes(location, () -> fetcher.fetch(location, run));
        Rasters rasters;
        try {
            rasters = firstDirectory(bytes, location).readRasters(new int[]{bandNumber - 1});
        } catch (TiffException e) {
            throw new RasterSourceException("Failed to decode pixels of " + location + ": " + e.getMessage(), e);
        }
        int width = rasters.getWidth();
        int height = rasters.getHeight();
        if (width != header.geometry().width() || height != header.geometry().height()) {
            throw new RasterSourceException("Raster " + location + " changed size since it was opened");
        }
        double[] values = new double[width * height];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                values[row * width + col] = rasters.getPixelSample(0, col, row).doubleValue();
            }
        }
        return values;
    }

    /**
     * Reads the first image directory from a leading slice of the file, widening the slice while the
     * directory or its tag values lie past its end.
     */
    private FileDirectory headerDirectory(String location, AssemblyRun run) throws IOException {
        int window = HEADER_WINDOW;
        while (true) {
            byte[] prefix = fetcher.fetchPrefix(location, window, run);
            try {
                return firstDirectory(prefix, location);
            } catch (RasterSourceException e) {
                throw e;
            } catch (RuntimeException e) {
                if (prefix.length < window || window >= MAX_WINDOW || !isClassicTiff(prefix)) {
                    throw new RasterSourceException("Not a readable TIFF: " + location + ": " + e.getMessage(), e);
                }
                int next = nextWindow(prefix, window);
                logger.debug("Header of {} extends past the first {} bytes; fetching {}", location, window, next);
                window = next;
            }
        }
    }

    private static FileDirectory firstDirectory(byte[] bytes, String location) {
        TIFFImage image = TiffReader.readTiff(bytes);
        FileDirectory directory = image.getFileDirectory();
        if (directory == null) {
            throw new RasterSourceException("No image directory in " + location);
        }
        return directory;
    }

    static boolean isClassicTiff(byte[] prefix) {
        if (prefix.length < 8) {
            return false;
        }
        if (prefix[0] == 'I' && prefix[1] == 'I') {
            return prefix[2] == 42 && prefix[3] == 0;
        }
        if (prefix[0] == 'M' && prefix[1] == 'M') {
            return prefix[2] == 0 && prefix[3] == 42;
        }
        return false;
    }

    /**
     * Double the window, or reach one window past the first directory's offset if that is further.
     */
    static int nextWindow(byte[] prefix, int window) {
        ByteOrder order = prefix[0] == 'I' ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
        long directoryOffset = Integer.toUnsignedLong(ByteBuffer.wrap(prefix, 4, 4).order(order).getInt());
        long wanted = Math.max(2L * window, directoryOffset + HEADER_WINDOW);
        return (int) Math.min(wanted, MAX_WINDOW);
    }

    GridGeometry geometry(FileDirectory directory, int height, int width) {
        String crs = crs(directory);
        double[] transform = doubles(directory, TAG_MODEL_TRANSFORMATION);
        if (transform != null && transform.length >= 8) {
            if (transform[1] != 0 || transform[4] != 0) {
                throw new RasterSourceException("Rotated rasters are not supported");
            }
            return GridGeometry.fromAffine(height, width, transform[3], transform[7], transform[0], -transform[5], crs);
        }
        double[] scale = doubles(directory, TAG_MODEL_PIXEL_SCALE);
        double[] tie = doubles(directory, TAG_MODEL_TIEPOINT);
        if (scale == null || scale.length < 2 || tie == null || tie.length < 6) {
            return GridGeometry.indexed(height, width, crs);
        }
        double originX = tie[3] - tie[0] * scale[0];
        double originY = tie[4] + tie[1] * scale[1];
        if (geoKey(directory, KEY_RASTER_TYPE) == RASTER_PIXEL_IS_POINT) {
            // tie point names a pixel centre; shift to the corner
            originX -= 0.5 * scale[0];
            originY += 0.5 * scale[1];
        }
        return GridGeometry.fromAffine(height, width, originX, originY, scale[0], scale[1], crs);
    }

    String crs(FileDirectory directory) {
        int code = geoKey(directory, KEY_PROJECTED_CS_TYPE);
        if (code <= 0 || code == USER_DEFINED) {
            code = geoKey(directory, KEY_GEOGRAPHIC_TYPE);
        }
        return code > 0 && code != USER_DEFINED ? "EPSG:" + code : null;
    }

    /**
     * Value of a short GeoKey stored inline in the GeoKeyDirectory, or -1.
     */
    private int geoKey(FileDirectory directory, int keyId) {
        double[] keys = doubles(directory, TAG_GEO_KEY_DIRECTORY);
        if (keys == null || keys.length < 4 || keys[0] != 1) {
            return -1;
        }
        int count = (int) keys[3];
        for (int i = 0; i < count && 4 + i * 4 + 3 < keys.length; i++) {
            int base = 4 + i * 4;
            if ((int) keys[base] == keyId && keys[base + 1] == 0 && keys[base + 2] == 1) {
                return (int) keys[base + 3];
            }
        }
        return -1;
    }

    private Double nodata(FileDirectory directory) {
        FileDirectoryEntry entry = entry(directory, TAG_GDAL_NODATA);
        if (entry == null) {
            return null;
        }
        Object values = entry.getValues();
        String text = values instanceof List<?> list && !list.isEmpty() ? String.valueOf(list.get(0)) : String.valueOf(values);
        text = text.replace("\u0000", "").trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparseable GDAL_NODATA value '{}'", text);
            return null;
        }
    }

    private String dtype(FileDirectory directory) {
        List<Integer> bits = directory.getBitsPerSample();
        List<Integer> formats = directory.getSampleFormat();
        int bitCount = bits != null && !bits.isEmpty() ? bits.get(0) : 8;
        int format = formats != null && !formats.isEmpty() ? formats.get(0) : 1;
        switch (format) {
            case 2:
                return "int" + bitCount;
            case 3:
                return "float" + bitCount;
            default:
                return "uint" + bitCount;
        }
    }

    private static FileDirectoryEntry entry(FileDirectory directory, int tagId) {
        for (FileDirectoryEntry entry : directory.getEntries()) {
            if (entry.getFieldTag() != null && entry.getFieldTag().getId() == tagId) {
                return entry;
            }
        }
        return null;
    }

    private static double[] doubles(FileDirectory directory, int tagId) {
        FileDirectoryEntry entry = entry(directory, tagId);
        if (entry == null) {
            return null;
        }
        Object values = entry.getValues();
        if (values instanceof List<?> list) {
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                out[i] = ((Number) list.get(i)).doubleValue();
            }
            return out;
        }
        if (values instanceof Number number) {
            return new double[]{number.doubleValue()};
        }
        return null;
    }
}
