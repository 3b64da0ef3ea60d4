package com.cecil.assembler.service;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Compiles strptime-style patterns ({@code %Y-%m-%d}, {@code %Y/%m/%d/%H/%M/%S}, ...) into strict
 * {@link DateTimeFormatter}s. Fields the pattern leaves out default to the start of their period.
 */
final class StrftimePattern {

    private StrftimePattern() {
    }

    static DateTimeFormatter compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Time pattern is empty");
        }
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().parseCaseInsensitive();
        Set<Character> seen = new HashSet<>();

        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '%') {
                builder.appendLiteral(c);
                continue;
            }
            if (i + 1 >= pattern.length()) {
                throw new IllegalArgumentException("Dangling '%' at end of pattern " + pattern);
            }
            char directive = pattern.charAt(++i);
            // numbers directly followed by another directive must have a fixed width to split
            boolean adjacent = i + 1 < pattern.length() && pattern.charAt(i + 1) == '%'
                    && i + 2 < pattern.length() && pattern.charAt(i + 2) != '%';
            seen.add(directive);
            switch (directive) {
                case 'Y':
                    builder.appendValue(ChronoField.YEAR, 4);
                    break;
                case 'y':
                    builder.appendValueReduced(ChronoField.YEAR, 2, 2, 1969);
                    break;
                case 'm':
                    number(builder, ChronoField.MONTH_OF_YEAR, 2, adjacent);
                    break;
                case 'd':
                    number(builder, ChronoField.DAY_OF_MONTH, 2, adjacent);
                    break;
                case 'H':
                    number(builder, ChronoField.HOUR_OF_DAY, 2, adjacent);
                    break;
                case 'I':
                    number(builder, ChronoField.CLOCK_HOUR_OF_AMPM, 2, adjacent);
                    break;
                case 'M':
                    number(builder, ChronoField.MINUTE_OF_HOUR, 2, adjacent);
                    break;
                case 'S':
                    number(builder, ChronoField.SECOND_OF_MINUTE, 2, adjacent);
                    break;
                case 'j':
                    number(builder, ChronoField.DAY_OF_YEAR, 3, adjacent);
                    break;
                case 'f':
                    builder.appendFraction(ChronoField.NANO_OF_SECOND, 1, 6, false);
                    break;
                case 'p':
                    builder.appendText(ChronoField.AMPM_OF_DAY, TextStyle.SHORT);
                    break;
                case 'b':
                    builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
                    break;
                case 'B':
                    builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
                    break;
                case 'a':
                    builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
                    break;
                case 'A':
                    builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL);
                    break;
                case 'z':
                    builder.optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
                            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd();
                    break;
                case 'Z':
                    builder.appendZoneText(TextStyle.SHORT);
                    break;
                case '%':
                    builder.appendLiteral('%');
                    break;
                default:
                    throw new IllegalArgumentException(
                            "Unsupported directive %" + directive + " in pattern " + pattern);
            }
        }

        if (!seen.contains('Y') && !seen.contains('y')) {
            builder.parseDefaulting(ChronoField.YEAR, 1900);
        }
        if (!seen.contains('j')) {
            if (!seen.contains('m') && !seen.contains('b') && !seen.contains('B')) {
                builder.parseDefaulting(ChronoField.MONTH_OF_YEAR, 1);
            }
            if (!seen.contains('d')) {
                builder.parseDefaulting(ChronoField.DAY_OF_MONTH, 1);
            }
        }
        if (seen.contains('I')) {
            if (!seen.contains('p')) {
                builder.parseDefaulting(ChronoField.AMPM_OF_DAY, 0);
            }
        } else if (!seen.contains('H')) {
            builder.parseDefaulting(ChronoField.HOUR_OF_DAY, 0);
        }
        if (!seen.contains('M')) {
            builder.parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0);
        }
        if (!seen.contains('S')) {
            builder.parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0);
        }

        return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }

    private static void number(DateTimeFormatterBuilder builder, ChronoField field, int maxWidth, boolean fixed) {
        if (fixed) {
            builder.appendValue(field, maxWidth);
        } else {
            builder.appendValue(field, 1, maxWidth, SignStyle.NOT_NEGATIVE);
        }
    }
}
