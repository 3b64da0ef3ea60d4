package com.cecil.assembler.service;

import com.cecil.assembler.model.BandTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Turns raw per-band timestamps into sortable {@link BandTime}s.
 * <p>
 * With an explicit pattern the timestamp must match it, otherwise {@link TimeParseException}. Without one,
 * the configured fallback patterns are tried in order and a timestamp none of them accepts becomes
 * {@link BandTime#NONE}. Timestamps without a zone are read as UTC.
 */
@Service
public class TimeParser {

    private static final Logger logger = LoggerFactory.getLogger(TimeParser.class);

    public static final String DEFAULT_FALLBACK_FORMATS = "%Y-%m-%dT%H:%M:%S,%Y-%m-%d,%Y/%m/%d/%H/%M/%S,%Y";

    private final List<String> fallbackPatterns;
    private final List<DateTimeFormatter> fallbackFormatters;
    private final Map<String, DateTimeFormatter> compiled = new ConcurrentHashMap<>();

    public TimeParser(@Value("${assembler.time.fallback-formats:" + DEFAULT_FALLBACK_FORMATS + "}") String fallbackFormatsProperty) {
        this.fallbackPatterns = parsePatternList(fallbackFormatsProperty);
        List<DateTimeFormatter> formatters = new ArrayList<>();
        for (String pattern : fallbackPatterns) {
            formatters.add(StrftimePattern.compile(pattern));
        }
        this.fallbackFormatters = Collections.unmodifiableList(formatters);
    }

    public List<String> getFallbackPatterns() {
        return fallbackPatterns;
    }

    /**
     * Parses {@code raw} with {@code pattern} when one is given, otherwise with the fallback list.
     * A missing {@code raw} is always {@link BandTime#NONE}.
     */
    public BandTime parse(String raw, String pattern) {
        if (raw == null || raw.isBlank()) {
            return BandTime.NONE;
        }
        if (pattern != null && !pattern.isBlank()) {
            return parseExplicit(raw, pattern);
        }
        return parseWithFallback(raw);
    }

    /**
     * @throws TimeParseException if {@code raw} does not match {@code pattern} or the pattern is unusable
     */
    public BandTime parseExplicit(String raw, String pattern) {
        DateTimeFormatter formatter;
        try {
            formatter = compiled.computeIfAbsent(pattern, StrftimePattern::compile);
        } catch (IllegalArgumentException e) {
            throw new TimeParseException("Invalid time pattern '" + pattern + "': " + e.getMessage(), e);
        }
        try {
            return BandTime.of(toInstant(formatter.parse(raw.trim())));
        } catch (DateTimeException e) {
            throw new TimeParseException("Time '" + raw + "' does not match pattern '" + pattern + "'", e);
        }
    }

    /**
     * Never throws; unparseable input yields {@link BandTime#NONE}.
     */
    public BandTime parseWithFallback(String raw) {
        if (raw == null || raw.isBlank()) {
            return BandTime.NONE;
        }
        String value = raw.trim();
        for (DateTimeFormatter formatter : fallbackFormatters) {
            try {
                return BandTime.of(toInstant(formatter.parse(value)));
            } catch (DateTimeException e) {
                // next pattern
            }
        }
        logger.debug("Time '{}' matched none of {}; treating band as untimed.", raw, fallbackPatterns);
        return BandTime.NONE;
    }

    private static Instant toInstant(TemporalAccessor parsed) {
        if (parsed.query(TemporalQueries.zone()) != null) {
            return ZonedDateTime.from(parsed).toInstant();
        }
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return ZonedDateTime.from(parsed).toInstant();
        }
        return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
    }

    private static List<String> parsePatternList(String property) {
        if (property == null || property.isBlank()) {
            return List.of();
        }
        return Arrays.stream(property.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }
}
