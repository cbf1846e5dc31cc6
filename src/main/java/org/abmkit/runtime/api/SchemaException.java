package org.abmkit.runtime.api;

/**
 * Thrown at model construction when an agent type's declared fields do not match
 * the shape the core requires, e.g. a missing leading {@code id} field or a {@code pos}
 * field whose type does not fit the configured space.
 */
public class SchemaException extends IllegalArgumentException {

    /**
     * Creates a new schema exception.
     * @param agentType the offending agent type
     * @param message description of the violated rule
     */
    public SchemaException(Class<?> agentType, String message) {
        super(String.format("Invalid agent type %s: %s", agentType.getName(), message));
    }

    /**
     * Creates a new schema exception without a specific agent type.
     * @param message description of the violated rule
     */
    public SchemaException(String message) {
        super(message);
    }
}
