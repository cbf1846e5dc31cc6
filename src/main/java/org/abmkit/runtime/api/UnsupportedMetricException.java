package org.abmkit.runtime.api;

import org.abmkit.runtime.space.Metric;

/**
 * Thrown when an operation needs a set of lattice offsets at a fixed radius but the grid's
 * metric does not define one (Euclidean distance on an integer lattice).
 */
public class UnsupportedMetricException extends UnsupportedOperationException {

    private final Metric metric;

    /**
     * Creates a new UnsupportedMetricException.
     * @param metric the metric of the space
     * @param message the detail message
     */
    public UnsupportedMetricException(Metric metric, String message) {
        super(message);
        this.metric = metric;
    }

    public Metric getMetric() {
        return metric;
    }
}
