package com.cecil.assembler.model;

/**
 * Header of an opened raster source: everything known without reading pixels.
 *
 * @param location  where the source was opened from
 * @param bandCount number of bands the source declares
 * @param geometry  grid shared by all bands
 * @param dtype     pixel type name, may be null
 * @param nodata    no-data value, may be null
 */
public record RasterHeader(String location, int bandCount, GridGeometry geometry, String dtype, Double nodata) {}
