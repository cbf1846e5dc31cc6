package org.abmkit.runtime.scheduler;

import org.abmkit.runtime.model.Agent;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A factory for creating schedulers by name, as used in configuration files.
 * It uses a registry to store the known policies; applications can register their own.
 */
public final class SchedulerFactory {

    private static final Map<String, ISchedulerCreator> registry = new HashMap<>();

    static {
        register("fastest", params -> Schedulers.fastest());
        register("by-id", params -> Schedulers.byId());
        register("randomly", params -> Schedulers.randomly());
        register("partially", params -> {
            Object fraction = params.get("fraction");
            if (fraction == null) {
                throw new IllegalArgumentException("Scheduler 'partially' requires a numeric 'fraction'.");
            }
            return Schedulers.partially(doubleParam("partially", "fraction", fraction));
        });
        register("by-property", params -> {
            Object property = params.get("property");
            if (property == null) {
                throw new IllegalArgumentException("Scheduler 'by-property' requires a 'property' name.");
            }
            return Schedulers.byProperty(property.toString());
        });
        register("by-type", params -> Schedulers.byType(
                booleanParam("by-type", "shuffle-types", params.getOrDefault("shuffle-types", false)),
                booleanParam("by-type", "shuffle-agents", params.getOrDefault("shuffle-agents", false))));
    }

    private SchedulerFactory() {}

    /**
     * Registers a new scheduler creator.
     * @param type The type name of the scheduler.
     * @param creator The creator for the scheduler.
     */
    public static void register(String type, ISchedulerCreator creator) {
        registry.put(type.toLowerCase(Locale.ROOT), creator);
    }

    /**
     * Creates a new scheduler.
     * @param type The type of the scheduler to create.
     * @param params The parameters for the scheduler.
     * @return The created scheduler.
     * @throws IllegalArgumentException if the scheduler type is unknown.
     */
    public static IScheduler<Agent> create(String type, Map<String, Object> params) {
        Objects.requireNonNull(type, "Scheduler type cannot be null.");
        ISchedulerCreator creator = registry.get(type.toLowerCase(Locale.ROOT));
        if (creator == null) {
            throw new IllegalArgumentException("Unknown scheduler type: " + type);
        }
        return creator.create(params != null ? params : Map.of());
    }

    /**
     * Reads a numeric parameter. Overrides from system properties or the environment arrive as
     * strings and are parsed.
     */
    static double doubleParam(String scheduler, String key, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Scheduler '" + scheduler + "' requires a numeric '" + key
                        + "', got " + text, e);
            }
        }
        throw new IllegalArgumentException("Scheduler '" + scheduler + "' requires a numeric '" + key + "', got " + value);
    }

    /**
     * Reads a boolean parameter, accepting the same string spellings as HOCON
     * ({@code true/false}, {@code yes/no}, {@code on/off}).
     */
    static boolean booleanParam(String scheduler, String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "on":
                    return true;
                case "false", "no", "off":
                    return false;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Scheduler '" + scheduler + "' requires a boolean '" + key + "', got " + value);
    }
}
