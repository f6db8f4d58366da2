package io.watson.datasource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered collection of {@link Diagnostic}s gathered during one host call.
 *
 * <p>Not thread-safe. Each call builds its own instance and hands it to the caller with the result.
 */
public final class Diagnostics {
    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostics add(Diagnostic diagnostic) {
        entries.add(Objects.requireNonNull(diagnostic, "diagnostic"));
        return this;
    }

    public Diagnostics addError(String summary, String detail) {
        return add(Diagnostic.error(summary, detail));
    }

    public Diagnostics addWarning(String summary, String detail) {
        return add(Diagnostic.warning(summary, detail));
    }

    public Diagnostics addAll(Diagnostics other) {
        entries.addAll(other.entries);
        return this;
    }

    public boolean hasError() {
        for (Diagnostic d : entries) {
            if (d.isError()) return true;
        }
        return false;
    }

    public List<Diagnostic> errors() {
        return entries.stream().filter(Diagnostic::isError).collect(Collectors.toUnmodifiableList());
    }

    public List<Diagnostic> warnings() {
        return entries.stream().filter(d -> !d.isError()).collect(Collectors.toUnmodifiableList());
    }

    public List<Diagnostic> asList() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "Diagnostics" + entries;
    }
}
