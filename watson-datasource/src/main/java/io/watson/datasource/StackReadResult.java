package io.watson.datasource;

import io.watson.client.Stack;

import java.util.Objects;
import java.util.Optional;

/**
 * State of one stack read. The stack is absent whenever {@link #diagnostics()} holds an error.
 */
public record StackReadResult(String id, Optional<Stack> stack, Diagnostics diagnostics) {

    public StackReadResult {
        Objects.requireNonNull(stack, "stack");
        Objects.requireNonNull(diagnostics, "diagnostics");
    }
}
