package org.abmkit.runtime.scheduler;

import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.model.AgentTypes;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Factory methods for the built-in scheduling policies.
 */
public final class Schedulers {

    private Schedulers() {}

    /**
     * Container order, no extra work.
     */
    public static IScheduler<Agent> fastest() {
        return Fastest.INSTANCE;
    }

    /**
     * Ascending ids.
     */
    public static IScheduler<Agent> byId() {
        return ById.INSTANCE;
    }

    /**
     * A fresh random permutation of all ids on every call.
     */
    public static IScheduler<Agent> randomly() {
        return Randomly.INSTANCE;
    }

    /**
     * A fresh random sample of {@code rint(fraction * N)} ids on every call.
     *
     * @param fraction share of agents to activate, in {@code [0, 1]}
     * @throws IllegalArgumentException if the fraction is outside {@code [0, 1]}
     */
    public static IScheduler<Agent> partially(double fraction) {
        return new Partially(fraction);
    }

    /**
     * Ascending by a numeric property read through an accessor.
     */
    public static <A extends Agent> IScheduler<A> byProperty(ToDoubleFunction<? super A> property) {
        return new ByProperty<>(Objects.requireNonNull(property, "property"), "accessor");
    }

    /**
     * Ascending by a numeric instance field, looked up by name on each agent's class.
     */
    public static IScheduler<Agent> byProperty(String fieldName) {
        return ByProperty.ofField(Objects.requireNonNull(fieldName, "fieldName"));
    }

    /**
     * Groups by concrete class in the canonical order of the model's agent union.
     */
    public static IScheduler<Agent> byType(boolean shuffleTypes, boolean shuffleAgents) {
        return new ByType<>(null, shuffleTypes, shuffleAgents);
    }

    /**
     * Groups by concrete class in the canonical order of the given union. The union may list
     * concrete classes or sealed hierarchies in any order.
     */
    @SafeVarargs
    public static IScheduler<Agent> byType(boolean shuffleTypes, boolean shuffleAgents, Class<? extends Agent>... union) {
        List<Class<? extends Agent>> members = AgentTypes.unionOf(Arrays.asList(union));
        return new ByType<>(members, shuffleTypes, shuffleAgents);
    }

    /**
     * Groups by concrete class in exactly the given order.
     */
    public static <A extends Agent> IScheduler<A> byType(List<? extends Class<? extends A>> order, boolean shuffleAgents) {
        return new ByType<>(Objects.requireNonNull(order, "order"), false, shuffleAgents);
    }
}
