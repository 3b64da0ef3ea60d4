package com.cecil.assembler.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of one assembly run: one array per variable, provenance attributes and the diagnostics of every
 * condition that was recovered on the way. Closing it releases the object-store clients its lazy planes
 * still read through.
 */
public final class AssembledDataset implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AssembledDataset.class);

    private final Map<String, GriddedArray> variables;
    private final Map<String, String> attributes;
    private final List<AssemblyDiagnostic> diagnostics;
    private final List<AutoCloseable> resources;

    public AssembledDataset(Map<String, GriddedArray> variables,
                            Map<String, String> attributes,
                            List<AssemblyDiagnostic> diagnostics,
                            List<AutoCloseable> resources) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.diagnostics = List.copyOf(diagnostics);
        this.resources = new ArrayList<>(resources);
    }

    public Map<String, GriddedArray> variables() {
        return variables;
    }

    public Set<String> variableNames() {
        return variables.keySet();
    }

    public GriddedArray get(String variableName) {
        return variables.get(variableName);
    }

    public boolean contains(String variableName) {
        return variables.containsKey(variableName);
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public List<AssemblyDiagnostic> diagnostics() {
        return diagnostics;
    }

    public List<AssemblyDiagnostic> diagnostics(AssemblyDiagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).collect(Collectors.toList());
    }

    @Override
    public synchronized void close() {
        IllegalStateException failure = null;
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("Failed to release assembly resource {}: {}", resource, e.getMessage());
                if (failure == null) {
                    failure = new IllegalStateException("Failed to release assembly resources", e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        resources.clear();
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "AssembledDataset[variables=" + variables.values() + ", attributes=" + attributes + "]";
    }
}
