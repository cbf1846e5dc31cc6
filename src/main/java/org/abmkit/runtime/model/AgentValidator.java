package org.abmkit.runtime.model;

import org.abmkit.runtime.api.SchemaException;
import org.abmkit.runtime.space.ContinuousSpace;
import org.abmkit.runtime.space.ISpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One-time structural check of agent types against the configured space.
 * <p>
 * Hard violations raise {@link SchemaException}. Advisory findings (immutable agent types,
 * non-concrete declared types, odd {@code vel} fields) are logged at WARN and only when
 * warnings are enabled.
 */
public final class AgentValidator {

    private static final Logger LOG = LoggerFactory.getLogger(AgentValidator.class);

    private static final Set<Class<?>> INTEGER_TYPES = Set.of(
            int.class, long.class, short.class, byte.class,
            Integer.class, Long.class, Short.class, Byte.class);

    private AgentValidator() {}

    /**
     * Validates an agent type and returns its canonical members.
     *
     * @param agentType the declared agent type; may be concrete, sealed or abstract
     * @param explicitMembers member types declared by the caller, or empty to derive them from {@code agentType}
     * @param space the model's space, or {@code null}
     * @param warn whether advisory findings are logged
     * @param <A> the agent type
     * @return the canonical list of concrete member types
     * @throws SchemaException if any member violates a structural rule
     */
    public static <A> List<Class<? extends A>> validate(Class<A> agentType, List<Class<? extends A>> explicitMembers,
                                                        ISpace<?> space, boolean warn) {
        List<Class<? extends A>> members;
        if (AgentTypes.isConcrete(agentType)) {
            members = List.of(agentType);
        } else {
            members = explicitMembers.isEmpty() ? AgentTypes.unionTypes(agentType) : AgentTypes.unionOf(explicitMembers);
            if (warn) {
                LOG.warn("Agent type {} is not concrete; validating its member types {}. "
                        + "Disable warnings to silence this for mixed-agent models.", agentType.getSimpleName(), simpleNames(members));
            }
        }
        for (Class<? extends A> member : members) {
            if (!agentType.isAssignableFrom(member)) {
                throw new SchemaException(member, "not a subtype of the declared agent type " + agentType.getName());
            }
            validateMember(member, space, warn);
        }
        return members;
    }

    /**
     * Applies the structural rules to one concrete agent type.
     */
    static void validateMember(Class<?> type, ISpace<?> space, boolean warn) {
        List<Field> fields = instanceFields(type);
        if (warn && isImmutable(type, fields)) {
            LOG.warn("Agent type {} is not mutable, and most library functions assume that it is.", type.getSimpleName());
        }
        if (fields.isEmpty() || !fields.get(0).getName().equals("id")) {
            throw new SchemaException(type, "First field of agent type must be `id` (and should be of an integer type).");
        }
        if (!INTEGER_TYPES.contains(fields.get(0).getType())) {
            throw new SchemaException(type, "`id` field in agent type must be of an integer type.");
        }
        if (space == null) {
            return;
        }
        if (fields.size() < 2 || !fields.get(1).getName().equals("pos")) {
            throw new SchemaException(type, "Second field of agent type must be `pos` when using a space.");
        }
        if (!PositionedAgent.class.isAssignableFrom(type)) {
            throw new SchemaException(type, "Agent type must implement PositionedAgent when using a space.");
        }
        Class<?> posType = fields.get(1).getType();
        if (!space.acceptsPositionField(posType)) {
            throw new SchemaException(type, String.format("`pos` field in agent type must be of type %s when using %s, found %s.",
                    space.describePositionType(), space.getClass().getSimpleName(), posType.getSimpleName()));
        }
        if (warn && space instanceof ContinuousSpace) {
            Optional<Field> vel = fields.stream().filter(f -> f.getName().equals("vel")).findFirst();
            if (vel.isPresent() && vel.get().getType() != double[].class) {
                LOG.warn("`vel` field in agent type {} should be of type double[] when using ContinuousSpace, found {}.",
                        type.getSimpleName(), vel.get().getType().getSimpleName());
            }
        }
    }

    /**
     * Lists instance fields from the root superclass down, in declaration order within each
     * class. Records contribute their components.
     */
    static List<Field> instanceFields(Class<?> type) {
        List<Field> result = new ArrayList<>();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                try {
                    result.add(type.getDeclaredField(component.getName()));
                } catch (NoSuchFieldException e) {
                    throw new IllegalStateException("Record component without backing field: " + component.getName(), e);
                }
            }
            return result;
        }
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                    result.add(field);
                }
            }
        }
        return result;
    }

    private static boolean isImmutable(Class<?> type, List<Field> fields) {
        if (type.isRecord()) {
            return true;
        }
        return !fields.isEmpty() && fields.stream().allMatch(f -> Modifier.isFinal(f.getModifiers()));
    }

    private static List<String> simpleNames(List<? extends Class<?>> types) {
        return types.stream().map(Class::getSimpleName).toList();
    }
}
