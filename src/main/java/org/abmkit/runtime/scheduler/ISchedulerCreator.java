package org.abmkit.runtime.scheduler;

import org.abmkit.runtime.model.Agent;

import java.util.Map;

/**
 * Creates a scheduler from configuration parameters.
 */
@FunctionalInterface
public interface ISchedulerCreator {
    IScheduler<Agent> create(Map<String, Object> params);
}
