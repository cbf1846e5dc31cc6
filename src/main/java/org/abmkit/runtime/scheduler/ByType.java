package org.abmkit.runtime.scheduler;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.model.AgentTypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Activates agents grouped by their concrete class.
 * <p>
 * Groups follow an explicit type order if one was given, otherwise the canonical member order
 * of the union (the model's declared agent type unless a union was passed in). With
 * {@code shuffleTypes} the group order is reshuffled on every call; with
 * {@code shuffleAgents} the order inside each group is. Otherwise agents keep container order
 * within their group, so repeated calls on an unchanged model return identical lists.
 * Agents whose class is missing from the order come last, grouped in canonical order.
 *
 * @param <A> the agent type
 */
public final class ByType<A extends Agent> implements IScheduler<A> {

    private final List<Class<?>> order;
    private final boolean shuffleTypes;
    private final boolean shuffleAgents;

    /**
     * @param order the group order, or {@code null} to use the model's canonical union
     * @param shuffleTypes reshuffle the group order on every call
     * @param shuffleAgents reshuffle each group on every call
     */
    ByType(List<? extends Class<?>> order, boolean shuffleTypes, boolean shuffleAgents) {
        this.order = order == null ? null : List.copyOf(order);
        this.shuffleTypes = shuffleTypes;
        this.shuffleAgents = shuffleAgents;
    }

    public boolean isShuffleTypes() {
        return shuffleTypes;
    }

    public boolean isShuffleAgents() {
        return shuffleAgents;
    }

    @Override
    public IntList schedule(AgentBasedModel<? extends A, ?> model) {
        List<? extends Class<?>> types;
        if (order != null) {
            types = order;
        } else {
            types = model.getAgentTypes();
        }
        Map<Class<?>, IntArrayList> partitions = new LinkedHashMap<>();
        for (Class<?> type : types) {
            partitions.put(type, new IntArrayList());
        }
        Map<Class<?>, IntArrayList> unlisted = new TreeMap<>(AgentTypes.CANONICAL_ORDER);

        IntList ids = model.ids();
        for (int i = 0; i < ids.size(); i++) {
            int id = ids.getInt(i);
            Class<?> type = model.get(id).getClass();
            IntArrayList partition = partitions.get(type);
            if (partition == null) {
                partition = unlisted.computeIfAbsent(type, t -> new IntArrayList());
            }
            partition.add(id);
        }

        List<IntArrayList> groups = new ArrayList<>(partitions.values());
        groups.addAll(unlisted.values());
        Random random = model.getRandomProvider().asJavaRandom();
        if (shuffleTypes) {
            Collections.shuffle(groups, random);
        }
        IntArrayList result = new IntArrayList(ids.size());
        for (IntArrayList group : groups) {
            if (shuffleAgents) {
                IntArrays.shuffle(group.elements(), 0, group.size(), random);
            }
            result.addAll(group);
        }
        return result;
    }

    @Override
    public String name() {
        return "ByType(shuffleTypes=" + shuffleTypes + ", shuffleAgents=" + shuffleAgents + ")";
    }
}
