package io.watson.datasource;

import java.util.Map;
import java.util.Objects;

/**
 * State of one outputs read.
 *
 * @param id the stack that was read
 * @param outputs string-valued outputs by name, empty when the read failed
 * @param diagnostics problems found while reading
 */
public record OutputsReadResult(String id, Map<String, OutputAttributes> outputs, Diagnostics diagnostics) {

    public OutputsReadResult {
        Objects.requireNonNull(diagnostics, "diagnostics");
        outputs = outputs == null ? Map.of() : outputs;
    }
}
