package org.abmkit.runtime.scheduler;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.model.Agent;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Activates agents in ascending order of a numeric property. Values are read once per call
 * before sorting; the sort is stable, so agents with equal values keep container order.
 *
 * @param <A> the agent type the property is read from
 */
public final class ByProperty<A extends Agent> implements IScheduler<A> {

    private final ToDoubleFunction<? super A> property;
    private final String description;

    ByProperty(ToDoubleFunction<? super A> property, String description) {
        this.property = property;
        this.description = description;
    }

    /**
     * Creates a scheduler reading a numeric instance field by name, e.g. {@code "weight"}.
     * Fields are looked up per concrete class on first use.
     *
     * @param fieldName the field name
     * @return the scheduler
     */
    static ByProperty<Agent> ofField(String fieldName) {
        return new ByProperty<>(new FieldReader(fieldName), fieldName);
    }

    @Override
    public IntList schedule(AgentBasedModel<? extends A, ?> model) {
        int[] ids = model.ids().toIntArray();
        double[] values = new double[ids.length];
        for (int i = 0; i < ids.length; i++) {
            values[i] = property.applyAsDouble(model.get(ids[i]));
        }
        int[] order = new int[ids.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        IntArrays.mergeSort(order, (a, b) -> Double.compare(values[a], values[b]));
        IntArrayList result = new IntArrayList(ids.length);
        for (int index : order) {
            result.add(ids[index]);
        }
        return result;
    }

    @Override
    public String name() {
        return "ByProperty(" + description + ")";
    }

    private static final class FieldReader implements ToDoubleFunction<Agent> {
        private final String fieldName;
        private final Map<Class<?>, Field> fields = new HashMap<>();

        FieldReader(String fieldName) {
            this.fieldName = fieldName;
        }

        @Override
        public double applyAsDouble(Agent agent) {
            Field field = fields.computeIfAbsent(agent.getClass(), this::lookup);
            try {
                Object value = field.get(agent);
                if (!(value instanceof Number number)) {
                    throw new IllegalArgumentException("Property '" + fieldName + "' of agent " + agent.getId() + " is not numeric: " + value);
                }
                return number.doubleValue();
            } catch (IllegalAccessException e) {
                throw new IllegalArgumentException("Cannot read property '" + fieldName + "' of " + agent.getClass().getName(), e);
            }
        }

        private Field lookup(Class<?> type) {
            for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
                for (Field field : c.getDeclaredFields()) {
                    if (field.getName().equals(fieldName) && !Modifier.isStatic(field.getModifiers())) {
                        field.setAccessible(true);
                        return field;
                    }
                }
            }
            throw new IllegalArgumentException("Agent type " + type.getName() + " has no property '" + fieldName + "'");
        }
    }
}
