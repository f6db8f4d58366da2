package io.watson.client;

import java.util.Objects;

/**
 * One named value published by a stack.
 *
 * @param value the value, typed by what the service sent
 * @param deprecated deprecation message, empty when the output is not deprecated
 * @param warning advisory message, empty when there is none
 * @param sensitive whether the value should be hidden from logs and plans
 */
public record Output(OutputValue value, String deprecated, String warning, boolean sensitive) {

    public Output {
        Objects.requireNonNull(value, "value");
        deprecated = deprecated == null ? "" : deprecated;
        warning = warning == null ? "" : warning;
    }

    public boolean isDeprecated() {
        return !deprecated.isEmpty();
    }

    public boolean hasWarning() {
        return !warning.isEmpty();
    }

    @Override
    public String toString() {
        String shown = sensitive ? "(sensitive)" : value.toString();
        return "Output[value=" + shown + ", deprecated=" + deprecated + ", warning=" + warning
                + ", sensitive=" + sensitive + "]";
    }
}
