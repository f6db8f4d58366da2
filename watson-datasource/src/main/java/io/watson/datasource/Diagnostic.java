package io.watson.datasource;

import java.util.Objects;

/**
 * A problem reported to the host instead of thrown.
 *
 * @param severity how the host should treat it
 * @param summary short, stable title
 * @param detail human readable explanation
 * @param attribute configuration attribute the problem is about, or {@code null}
 */
public record Diagnostic(Severity severity, String summary, String detail, String attribute) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(summary, "summary");
        detail = detail == null ? "" : detail;
    }

    public static Diagnostic error(String summary, String detail) {
        return new Diagnostic(Severity.ERROR, summary, detail, null);
    }

    public static Diagnostic attributeError(String attribute, String summary, String detail) {
        return new Diagnostic(Severity.ERROR, summary, detail, Objects.requireNonNull(attribute, "attribute"));
    }

    public static Diagnostic warning(String summary, String detail) {
        return new Diagnostic(Severity.WARNING, summary, detail, null);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
