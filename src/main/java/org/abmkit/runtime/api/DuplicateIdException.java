package org.abmkit.runtime.api;

/**
 * Thrown when an agent is added to a mapping container that already holds an agent with the same id.
 */
public class DuplicateIdException extends IllegalArgumentException {

    private final int id;

    /**
     * Creates a new DuplicateIdException.
     * @param id the id that is already taken
     */
    public DuplicateIdException(int id) {
        super("Can't add agent to model. There is already an agent with id=" + id);
        this.id = id;
    }

    /**
     * @return the id that was already present
     */
    public int getId() {
        return id;
    }
}
