package org.abmkit.runtime.api;

/**
 * Thrown when an agent added to a sequence container does not carry the id {@code count + 1}.
 */
public class IdSequenceException extends IllegalArgumentException {

    private final int id;
    private final int expectedId;

    /**
     * Creates a new IdSequenceException.
     * @param id the id of the rejected agent
     * @param count the number of agents currently stored
     */
    public IdSequenceException(int id, int count) {
        super(String.format("Cannot add agent of ID %d in a sequence container of %d agents. Expected ID == %d.",
                id, count, count + 1));
        this.id = id;
        this.expectedId = count + 1;
    }

    public int getId() {
        return id;
    }

    public int getExpectedId() {
        return expectedId;
    }
}
