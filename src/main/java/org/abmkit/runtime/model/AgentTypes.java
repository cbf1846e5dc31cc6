package org.abmkit.runtime.model;

import org.abmkit.runtime.api.SchemaException;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decomposes heterogeneous agent types into their concrete member classes.
 * <p>
 * A heterogeneous population is declared either as a sealed interface (or sealed abstract
 * class) whose permitted subclasses are the concrete agent types, or as an explicit list
 * of member classes. Both forms decompose into the same canonical sequence: members are
 * flattened, duplicates collapse, and the result is sorted by simple name and then by
 * fully qualified name. The order in which members were written never matters.
 */
public final class AgentTypes {

    /**
     * Canonical member order: simple name, then fully qualified name.
     */
    public static final Comparator<Class<?>> CANONICAL_ORDER =
            Comparator.<Class<?>, String>comparing(Class::getSimpleName).thenComparing(Class::getName);

    private AgentTypes() {}

    /**
     * Returns whether agents of exactly this class can exist.
     *
     * @param type the type to check
     * @return true for non-abstract classes
     */
    public static boolean isConcrete(Class<?> type) {
        return !type.isInterface() && !Modifier.isAbstract(type.getModifiers());
    }

    /**
     * Returns the canonical concrete members of a type. A concrete type is its own only member.
     *
     * @param type a concrete type or a sealed hierarchy
     * @param <A> the agent base type
     * @return the canonical, duplicate-free member list
     * @throws SchemaException if the type is abstract but not sealed
     */
    public static <A> List<Class<? extends A>> unionTypes(Class<A> type) {
        Objects.requireNonNull(type, "type");
        Set<Class<? extends A>> members = new LinkedHashSet<>();
        collect(type, members);
        return sorted(members);
    }

    /**
     * Canonicalizes an explicit member list. Members may themselves be sealed hierarchies.
     *
     * @param members the declared members, in any order
     * @param <A> the agent base type
     * @return the canonical, duplicate-free member list
     */
    public static <A> List<Class<? extends A>> unionOf(Collection<? extends Class<? extends A>> members) {
        Objects.requireNonNull(members, "members");
        Set<Class<? extends A>> flattened = new LinkedHashSet<>();
        for (Class<? extends A> member : members) {
            collect(Objects.requireNonNull(member, "member"), flattened);
        }
        return sorted(flattened);
    }

    @SuppressWarnings("unchecked")
    private static <A> void collect(Class<? extends A> type, Set<Class<? extends A>> out) {
        if (isConcrete(type)) {
            out.add(type);
            return;
        }
        if (!type.isSealed()) {
            throw new SchemaException(type, "type is neither concrete nor sealed; declare its member types explicitly.");
        }
        for (Class<?> permitted : type.getPermittedSubclasses()) {
            collect((Class<? extends A>) permitted, out);
        }
    }

    private static <A> List<Class<? extends A>> sorted(Set<Class<? extends A>> members) {
        List<Class<? extends A>> result = new ArrayList<>(members);
        result.sort(CANONICAL_ORDER);
        return List.copyOf(result);
    }
}
