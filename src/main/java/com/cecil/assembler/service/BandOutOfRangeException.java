package com.cecil.assembler.service;

/**
 * Requested band number lies outside the range a raster source declares. Never retried.
 */
public class BandOutOfRangeException extends AssemblyException {

    private final String location;
    private final int bandNumber;
    private final int bandCount;

    public BandOutOfRangeException(String location, int bandNumber, int bandCount) {
        super("Band " + bandNumber + " is outside 1.." + bandCount + " for " + location);
        this.location = location;
        this.bandNumber = bandNumber;
        this.bandCount = bandCount;
    }

    public String getLocation() {
        return location;
    }

    public int getBandNumber() {
        return bandNumber;
    }

    public int getBandCount() {
        return bandCount;
    }
}
