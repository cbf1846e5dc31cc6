package org.abmkit.runtime.scheduler;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.spi.IRandomProvider;

/**
 * Activates a random subset of {@code rint(fraction * N)} agents, drawn without replacement
 * and in random order. A new subset is drawn on every call.
 */
public final class Partially implements IScheduler<Agent> {

    private final double fraction;

    /**
     * @param fraction the share of agents to activate, in {@code [0, 1]}
     */
    Partially(double fraction) {
        if (!(fraction >= 0.0 && fraction <= 1.0)) {
            throw new IllegalArgumentException("Fraction must be within [0, 1], got " + fraction);
        }
        this.fraction = fraction;
    }

    public double getFraction() {
        return fraction;
    }

    @Override
    public IntList schedule(AgentBasedModel<? extends Agent, ?> model) {
        int[] ids = model.ids().toIntArray();
        int n = ids.length;
        int k = (int) Math.rint(fraction * n);
        IRandomProvider random = model.getRandomProvider();
        // Partial Fisher-Yates: the first k slots end up a uniform sample.
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = ids[i];
            ids[i] = ids[j];
            ids[j] = tmp;
        }
        return IntArrayList.wrap(ids, k);
    }

    @Override
    public String name() {
        return "Partially(" + fraction + ")";
    }
}
