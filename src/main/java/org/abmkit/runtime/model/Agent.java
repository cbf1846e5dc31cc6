package org.abmkit.runtime.model;

/**
 * A uniquely identified, mutable simulation entity.
 * <p>
 * Implementations are plain mutable classes whose first declared instance field is an
 * integer {@code id}. The id is stable for the agent's lifetime. Models validate the field
 * layout once at construction, see {@link AgentValidator}.
 */
public interface Agent {

    /**
     * @return the agent's unique, positive id
     */
    int getId();
}
