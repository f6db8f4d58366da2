package io.watson.datasource;

import io.watson.client.Stack;
import io.watson.client.WatsonClient;
import io.watson.core.WatsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Reads stack metadata, including the stacks that consume it.
 */
public final class StackDataSource {
    private static final Logger log = LoggerFactory.getLogger(StackDataSource.class);

    private final WatsonClient client;

    public StackDataSource(WatsonClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public StackReadResult read(String stack) {
        Diagnostics diagnostics = new Diagnostics();

        Optional<Stack> fetched;
        try {
            fetched = client.fetchStack(stack);
        } catch (WatsonException e) {
            diagnostics.addError("Failed to read stack \"" + stack + "\"", e.getMessage());
            return new StackReadResult(stack, Optional.empty(), diagnostics);
        }

        if (fetched.isEmpty()) {
            diagnostics.addError("Unknown stack", "No stack named \"" + stack + "\" could be found");
            return new StackReadResult(stack, Optional.empty(), diagnostics);
        }

        log.debug("Read stack {} used by {} stacks", stack, fetched.get().usedBy().size());
        return new StackReadResult(stack, fetched, diagnostics);
    }
}
