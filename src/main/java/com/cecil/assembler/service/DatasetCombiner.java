package com.cecil.assembler.service;

import com.cecil.assembler.model.AssemblyDiagnostic;
import com.cecil.assembler.model.GridGeometry;
import com.cecil.assembler.model.GriddedArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Unions per-variable arrays into one keyed structure.
 * <p>
 * Variables may have different axis sets (with or without time, different time coordinates), but variables
 * sharing a spatial axis must agree on its coordinates and on the CRS. When they do not, the largest group
 * of variables with the same spatial signature is kept and the rest are reported as excluded.
 */
@Service
public class DatasetCombiner {

    private static final Logger logger = LoggerFactory.getLogger(DatasetCombiner.class);

    /**
     * Spatial axis names present on a variable, sorted, with their sizes in the same order.
     */
    record Signature(List<String> axes, List<Integer> sizes) {

        static Signature of(GriddedArray array) {
            Map<String, Integer> spatial = new TreeMap<>(array.sizes());
            spatial.remove(GriddedArray.TIME);
            return new Signature(List.copyOf(spatial.keySet()), List.copyOf(spatial.values()));
        }
    }

    /**
     * @param arrays variables in encounter order
     * @return the variables that form the dataset, in encounter order
     * @throws NoAssemblableDataException when there is nothing to combine
     */
    public Map<String, GriddedArray> combine(Map<String, GriddedArray> arrays, AssemblyRun run) {
        if (arrays.isEmpty()) {
            throw new NoAssemblableDataException("No variable could be assembled for request " + run.getRequestId());
        }
        try {
            return union(arrays);
        } catch (CombineIncompatibleException e) {
            logger.warn("[{}] {}; falling back to the largest compatible group", run.getRequestId(), e.getMessage());
            return largestCompatibleGroup(arrays, run);
        }
    }

    /**
     * @throws CombineIncompatibleException if two variables disagree on a shared spatial axis or the CRS
     */
    Map<String, GriddedArray> union(Map<String, GriddedArray> arrays) {
        GriddedArray yOwner = null;
        GriddedArray xOwner = null;
        GriddedArray crsOwner = null;
        for (GriddedArray array : arrays.values()) {
            GridGeometry geometry = array.geometry();
            if (yOwner == null) {
                yOwner = array;
                xOwner = array;
                crsOwner = array;
                continue;
            }
            if (!yOwner.geometry().sameYAxis(geometry)) {
                throw clash(GriddedArray.Y, yOwner, array);
            }
            if (!xOwner.geometry().sameXAxis(geometry)) {
                throw clash(GriddedArray.X, xOwner, array);
            }
            if (!Objects.equals(crsOwner.geometry().crs(), geometry.crs())) {
                throw clash("crs", crsOwner, array);
            }
        }
        return new LinkedHashMap<>(arrays);
    }

    private Map<String, GriddedArray> largestCompatibleGroup(Map<String, GriddedArray> arrays, AssemblyRun run) {
        Map<Signature, List<GriddedArray>> groups = new LinkedHashMap<>();
        for (GriddedArray array : arrays.values()) {
            groups.computeIfAbsent(Signature.of(array), s -> new ArrayList<>()).add(array);
        }

        Signature chosen = null;
        for (Map.Entry<Signature, List<GriddedArray>> group : groups.entrySet()) {
            // strictly greater keeps the first group on ties
            if (chosen == null || group.getValue().size() > groups.get(chosen).size()) {
                chosen = group.getKey();
            }
        }

        List<GriddedArray> members = groups.get(chosen);
        GridGeometry reference = members.get(0).geometry();
        Map<String, GriddedArray> kept = new LinkedHashMap<>();
        for (Map.Entry<String, GriddedArray> entry : arrays.entrySet()) {
            GriddedArray array = entry.getValue();
            if (members.contains(array) && sameSpatialCoordinates(reference, array.geometry())) {
                kept.put(entry.getKey(), array);
            } else {
                String reason = members.contains(array)
                        ? "coordinates differ from " + members.get(0).name() + " despite equal sizes"
                        : "spatial signature " + Signature.of(array) + " is not the majority " + chosen;
                run.report(AssemblyDiagnostic.Kind.EXCLUDED_VARIABLE, entry.getKey(), "Excluded from dataset: " + reason);
            }
        }
        logger.info("[{}] Combined {} of {} variable(s) with signature {}",
                run.getRequestId(), kept.size(), arrays.size(), chosen);
        return kept;
    }

    private static boolean sameSpatialCoordinates(GridGeometry a, GridGeometry b) {
        return a.sameYAxis(b) && a.sameXAxis(b) && Objects.equals(a.crs(), b.crs());
    }

    private static CombineIncompatibleException clash(String axis, GriddedArray first, GriddedArray second) {
        return new CombineIncompatibleException("Variables " + first.name() + " and " + second.name()
                + " disagree on " + axis + " (" + first.geometry().describe() + " vs " + second.geometry().describe() + ")");
    }
}
