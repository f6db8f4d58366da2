package io.watson.datasource;

import io.watson.client.Output;
import io.watson.client.OutputValue;
import io.watson.client.Outputs;
import io.watson.client.WatsonClient;
import io.watson.core.WatsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the outputs of a stack and keeps only the string-valued ones.
 *
 * <p>Every other output is dropped with an "ignored output" warning. Deprecations and warnings
 * attached to an output surface as warnings too.
 */
public final class OutputsDataSource {
    private static final Logger log = LoggerFactory.getLogger(OutputsDataSource.class);

    private final WatsonClient client;

    public OutputsDataSource(WatsonClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public OutputsReadResult read(String stack) {
        Diagnostics diagnostics = new Diagnostics();

        Optional<Outputs> fetched;
        try {
            fetched = client.fetchOutputs(stack);
        } catch (WatsonException e) {
            diagnostics.addError("Failed to read outputs of \"" + stack + "\"", e.getMessage());
            return new OutputsReadResult(stack, Map.of(), diagnostics);
        }

        if (fetched.isEmpty()) {
            diagnostics.addError("Unknown stack", "No stack named \"" + stack + "\" could be found");
            return new OutputsReadResult(stack, Map.of(), diagnostics);
        }

        Map<String, OutputAttributes> result = new LinkedHashMap<>();
        fetched.get().asMap().forEach((key, output) -> {
            OutputValue value = output.value();
            if (value instanceof OutputValue.Text text) {
                result.put(key, OutputAttributes.of(text.value(), output));
            } else {
                log.warn("Ignoring output {} of {}: type {}", key, stack, value.type().tag());
                diagnostics.addWarning("ignored output",
                        "output \"" + key + "\" has type " + value.type().tag() + " and is ignored for now");
            }
            addAdvisories(key, output, diagnostics);
        });

        log.debug("Read {} outputs of {}", result.size(), stack);
        return new OutputsReadResult(stack, Collections.unmodifiableMap(result), diagnostics);
    }

    private static void addAdvisories(String key, Output output, Diagnostics diagnostics) {
        if (output.isDeprecated()) {
            diagnostics.addWarning("Output " + key + " is deprecated", output.deprecated());
        }
        if (output.hasWarning()) {
            diagnostics.addWarning("The output " + key + " has a warning", output.warning());
        }
    }
}
