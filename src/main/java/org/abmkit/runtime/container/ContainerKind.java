package org.abmkit.runtime.container;

import org.abmkit.runtime.model.Agent;

import java.util.Locale;

/**
 * Selects the storage strategy of a model.
 */
public enum ContainerKind {

    /**
     * Id-keyed, insertion-ordered map. Agents can be added with any unused id and removed.
     */
    MAPPING("StandardABM"),

    /**
     * Dense list. The k-th added agent must have id k; agents cannot be removed.
     */
    SEQUENCE("UnremovableABM");

    private final String modelName;

    ContainerKind(String modelName) {
        this.modelName = modelName;
    }

    /**
     * @return the display name of models using this container
     */
    public String modelName() {
        return modelName;
    }

    /**
     * Creates an empty container of this kind.
     *
     * @param <A> the agent type
     * @return the new container
     */
    public <A extends Agent> AgentContainer<A> create() {
        return switch (this) {
            case MAPPING -> new MappingContainer<>();
            case SEQUENCE -> new SequenceContainer<>();
        };
    }

    /**
     * Parses a container name as used in configuration files ("mapping" or "sequence").
     *
     * @param name the name, case-insensitive
     * @return the kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ContainerKind fromString(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unrecognised container '" + name + "', please specify either 'mapping' or 'sequence'.", e);
        }
    }
}
