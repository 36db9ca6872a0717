package com.lintmux.core.relay;

import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.Diagnostic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live per-file union of the diagnostics every child last reported.
 *
 * <p>Each child's contribution to a file is replaced, never appended to. The
 * union is built in child registration order and compared with the last value
 * handed out for that file, so an unchanged union yields nothing. Confined to
 * the orchestrator loop.
 */
public class DiagnosticsAggregator {

    /** file -> child -> that child's latest diagnostics for the file */
    private final Map<String, Map<ChildIdentity, List<Diagnostic>>> contributions = new HashMap<>();
    private final Map<String, List<Diagnostic>> lastEmitted = new HashMap<>();
    private final List<ChildIdentity> childOrder = new ArrayList<>();

    /**
     * Fixes the position of {@code child} in every merged list. Children not
     * registered are ordered after registered ones, by first report.
     */
    public void register(ChildIdentity child) {
        if (!childOrder.contains(child)) {
            childOrder.add(child);
        }
    }

    /**
     * Records {@code child}'s latest diagnostics for {@code file}.
     *
     * @return the new merged list, or empty when it equals the last one emitted
     */
    public Optional<List<Diagnostic>> update(ChildIdentity child, String file, List<Diagnostic> diagnostics) {
        register(child);
        var byChild = contributions.computeIfAbsent(file, f -> new HashMap<>());
        if (diagnostics.isEmpty()) {
            byChild.remove(child);
        } else {
            byChild.put(child, List.copyOf(diagnostics));
        }
        return emitIfChanged(file);
    }

    /**
     * Drops every contribution of {@code child}.
     *
     * @return the files whose merged list changed, with their new value
     */
    public Map<String, List<Diagnostic>> withdraw(ChildIdentity child) {
        var changed = new LinkedHashMap<String, List<Diagnostic>>();
        for (var entry : new ArrayList<>(contributions.entrySet())) {
            if (entry.getValue().remove(child) != null) {
                emitIfChanged(entry.getKey()).ifPresent(merged -> changed.put(entry.getKey(), merged));
            }
        }
        childOrder.remove(child);
        return changed;
    }

    /** Current union for {@code file}, in child order. */
    public List<Diagnostic> merged(String file) {
        var byChild = contributions.get(file);
        if (byChild == null || byChild.isEmpty()) {
            return List.of();
        }
        var merged = new ArrayList<Diagnostic>();
        for (ChildIdentity child : childOrder) {
            List<Diagnostic> diagnostics = byChild.get(child);
            if (diagnostics != null) {
                merged.addAll(diagnostics);
            }
        }
        return List.copyOf(merged);
    }

    public void clear() {
        contributions.clear();
        lastEmitted.clear();
        childOrder.clear();
    }

    private Optional<List<Diagnostic>> emitIfChanged(String file) {
        List<Diagnostic> merged = merged(file);
        if (merged.isEmpty()) {
            contributions.remove(file);
        }
        List<Diagnostic> previous = lastEmitted.getOrDefault(file, List.of());
        if (previous.equals(merged)) {
            return Optional.empty();
        }
        if (merged.isEmpty()) {
            lastEmitted.remove(file);
        } else {
            lastEmitted.put(file, merged);
        }
        return Optional.of(merged);
    }
}
