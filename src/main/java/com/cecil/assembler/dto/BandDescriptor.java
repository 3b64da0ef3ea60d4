package com.cecil.assembler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One band of a raster file, mapped to a logical variable.
 *
 * @param number       1-based band number inside the file
 * @param variableName variable this band contributes to
 * @param time         raw timestamp, may be null
 * @param timePattern  strptime-style pattern the timestamp must match, may be null
 * @param dtype        declared pixel type, may be null
 * @param nodata       declared no-data value, may be null
 */
public record BandDescriptor(
        @JsonProperty("number") int number,
        @JsonProperty("variable_name") String variableName,
        @JsonProperty("time") String time,
        @JsonProperty("time_pattern") String timePattern,
        @JsonProperty("dtype") String dtype,
        @JsonProperty("nodata") Double nodata
) {

    public BandDescriptor(int number, String variableName, String time, String timePattern) {
        this(number, variableName, time, timePattern, null, null);
    }
}
