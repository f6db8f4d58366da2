package io.watson.client;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Stack metadata as reported by the service.
 *
 * @param id canonical {@code namespace/name} identifier
 * @param name display name
 * @param url canonical URL of the stack resource
 * @param usedBy stacks that read this stack's outputs, in the order the service returned them
 */
public record Stack(String id, String name, String url, List<Dependent> usedBy) {

    public Stack {
        usedBy = usedBy == null ? List.of() : List.copyOf(usedBy);
    }

    /**
     * A reverse dependency recorded by the service when another stack reads this one.
     *
     * @param id identifier of the consuming stack
     * @param url URL of the consuming stack
     * @param lastUsedAt last time the consumer read this stack, null if the service did not say
     */
    public record Dependent(String id, String url, OffsetDateTime lastUsedAt) {
    }
}
