package com.cecil.assembler.service;

import com.cecil.assembler.model.AssemblyDiagnostic;
import com.cecil.assembler.model.BandTime;
import com.cecil.assembler.model.GridGeometry;
import com.cecil.assembler.model.GriddedArray;
import com.cecil.assembler.model.LazyPlane;
import com.cecil.assembler.model.MixedTimePolicy;
import com.cecil.assembler.model.RasterHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the single array of one variable from all bands mapped to it.
 * <p>
 * Bands are ordered by parsed time (untimed first, ties in encounter order), loaded as planes, and the timed
 * planes stacked along time. When untimed planes remain next to that stack, or several untimed planes
 * exist, the run's {@link MixedTimePolicy} decides the outcome.
 */
@Service
public class VariableMerger {

    private static final Logger logger = LoggerFactory.getLogger(VariableMerger.class);

    private final TimeParser timeParser;
    private final BandReader bandReader;

    public VariableMerger(TimeParser timeParser, BandReader bandReader) {
        this.timeParser = timeParser;
        this.bandReader = bandReader;
    }

    /**
     * @param variable variable name
     * @param refs     the variable's bands in encounter order
     * @param headers  opened headers by location; a location missing here was skipped as unreadable
     * @return the variable's array, or empty when none of its planes could be loaded
     */
    public Optional<GriddedArray> merge(String variable,
                                        List<BandRef> refs,
                                        Map<String, RasterHeader> headers,
                                        AssemblyRun run) {
        List<TimedRef> ordered = new ArrayList<>(refs.size());
        for (BandRef ref : refs) {
            ordered.add(new TimedRef(ref, parseTime(variable, ref)));
        }
        // List.sort is stable, so equal times keep their encounter order
        ordered.sort(Comparator.comparing(TimedRef::time));

        List<GriddedArray> timed = new ArrayList<>();
        List<GriddedArray> untimed = new ArrayList<>();
        for (TimedRef entry : ordered) {
            run.checkCancelled("loading " + variable);
            RasterHeader header = headers.get(entry.ref().location());
            if (header == null) {
                continue;
            }
            GriddedArray plane = bandReader.plane(header,
                    entry.ref().band().number(),
                    variable,
                    entry.ref().band().dtype(),
                    entry.ref().band().nodata(),
                    run);
            if (entry.time().isPresent()) {
                timed.add(plane.withTimeAxis(entry.time().instant()));
            } else {
                untimed.add(plane);
            }
        }

        if (timed.isEmpty() && untimed.isEmpty()) {
            run.report(AssemblyDiagnostic.Kind.EMPTY_VARIABLE, variable,
                    "No plane of " + refs.size() + " band(s) could be loaded; variable omitted");
            return Optional.empty();
        }

        List<GriddedArray> arrays = new ArrayList<>();
        if (!timed.isEmpty()) {
            if (timed.size() > 1) {
                run.checkCancelled("concatenating " + variable);
            }
            arrays.add(timed.size() == 1 ? timed.get(0) : concatTime(variable, timed));
        }
        arrays.addAll(untimed);

        if (arrays.size() == 1) {
            return Optional.of(arrays.get(0));
        }
        return Optional.of(resolveMixed(variable, timed, untimed, arrays, run));
    }

    private GriddedArray resolveMixed(String variable,
                                      List<GriddedArray> timed,
                                      List<GriddedArray> untimed,
                                      List<GriddedArray> arrays,
                                      AssemblyRun run) {
        MixedTimePolicy policy = run.getOptions().getMixedTimePolicy();
        switch (policy) {
            case REJECT:
                throw new AmbiguousTimeAxisException("Variable " + variable + " has " + timed.size()
                        + " timed and " + untimed.size() + " untimed plane(s); cannot build one array");
            case KEEP_FIRST:
                int dropped = arrays.subList(1, arrays.size()).stream().mapToInt(a -> a.planes().size()).sum();
                run.report(AssemblyDiagnostic.Kind.DISCARDED_PLANES, variable,
                        "Kept the first of " + arrays.size() + " arrays, discarded " + dropped + " plane(s)");
                return arrays.get(0);
            case EXPAND_WITH_SENTINEL:
            default:
                List<GriddedArray> stack = new ArrayList<>(untimed.size() + timed.size());
                // distinct coordinates keep the time index unique
                for (int i = 0; i < untimed.size(); i++) {
                    stack.add(untimed.get(i).withTimeAxis(BandTime.SENTINEL_INSTANT.plusMillis(i)));
                }
                stack.addAll(timed);
                logger.debug("Placing {} untimed plane(s) of {} from the sentinel time", untimed.size(), variable);
                run.checkCancelled("concatenating " + variable);
                return concatTime(variable, stack);
        }
    }

    /**
     * Stacks time-bearing arrays in the given order. Every part must have exactly the first part's grid.
     *
     * @throws DimensionMismatchException on any grid difference
     */
    GriddedArray concatTime(String variable, List<GriddedArray> parts) {
        GriddedArray first = parts.get(0);
        GridGeometry reference = first.geometry();
        List<Instant> times = new ArrayList<>();
        List<LazyPlane> planes = new ArrayList<>();
        for (GriddedArray part : parts) {
            if (!part.hasTimeAxis()) {
                throw new IllegalArgumentException("Cannot stack " + variable + ": part has no time axis");
            }
            GridGeometry geometry = part.geometry();
            if (!reference.equals(geometry)) {
                throw new DimensionMismatchException("Cannot stack " + variable + " along time: grid "
                        + geometry.describe() + " differs from " + reference.describe()
                        + " on " + differingAxes(reference, geometry));
            }
            times.addAll(part.times());
            planes.addAll(part.planes());
        }
        return GriddedArray.stacked(variable, reference, times, planes, first.dtype(), first.nodata());
    }

    private static String differingAxes(GridGeometry a, GridGeometry b) {
        List<String> axes = new ArrayList<>();
        if (!a.sameYAxis(b)) axes.add(GriddedArray.Y);
        if (!a.sameXAxis(b)) axes.add(GriddedArray.X);
        if (axes.isEmpty()) axes.add("crs");
        return String.join(",", axes);
    }

    private BandTime parseTime(String variable, BandRef ref) {
        try {
            return timeParser.parse(ref.band().time(), ref.band().timePattern());
        } catch (TimeParseException e) {
            throw new TimeParseException("Band " + ref.band().number() + " of " + ref.location()
                    + " (" + variable + "): " + e.getMessage(), e);
        }
    }

    private record TimedRef(BandRef ref, BandTime time) {}
}
