package io.watson.datasource;

import io.watson.client.Output;

import java.util.Objects;

/**
 * A string-valued output as exposed to the host.
 */
public record OutputAttributes(String value, boolean sensitive, String deprecated, String warning) {

    public OutputAttributes {
        Objects.requireNonNull(value, "value");
        deprecated = deprecated == null ? "" : deprecated;
        warning = warning == null ? "" : warning;
    }

    static OutputAttributes of(String value, Output output) {
        return new OutputAttributes(value, output.sensitive(), output.deprecated(), output.warning());
    }

    @Override
    public String toString() {
        return "OutputAttributes[value=" + (sensitive ? "(sensitive)" : value) + ", sensitive=" + sensitive
                + ", deprecated=" + deprecated + ", warning=" + warning + "]";
    }
}
