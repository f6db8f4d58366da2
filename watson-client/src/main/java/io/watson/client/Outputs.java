package io.watson.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The outputs of one stack, keyed by output name. Built fresh for every fetch and never mutated.
 */
public final class Outputs {

    private static final Outputs EMPTY = new Outputs(Map.of());

    private final Map<String, Output> entries;

    public Outputs(Map<String, Output> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Outputs empty() {
        return EMPTY;
    }

    public Optional<Output> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public Set<String> names() {
        return entries.keySet();
    }

    public Map<String, Output> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Outputs whose value is a string, keyed by name.
     */
    public Map<String, String> stringValues() {
        Map<String, String> out = new LinkedHashMap<>();
        entries.forEach((name, output) -> output.value().asString().ifPresent(v -> out.put(name, v)));
        return Collections.unmodifiableMap(out);
    }

    /**
     * One entry per output whose value is not a string.
     */
    public List<IgnoredOutput> ignored() {
        List<IgnoredOutput> out = new ArrayList<>();
        entries.forEach((name, output) -> {
            if (output.value() instanceof OutputValue.Other other) {
                out.add(new IgnoredOutput(name, other.type()));
            }
        });
        return List.copyOf(out);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Outputs other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Outputs" + entries;
    }
}
