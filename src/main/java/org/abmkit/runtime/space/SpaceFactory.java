package org.abmkit.runtime.space;

import com.typesafe.config.Config;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A factory for creating spaces from HOCON blocks such as
 * <pre>
 * space {
 *   type = "grid-single"
 *   extent = [10, 10]
 *   periodic = false
 *   metric = "manhattan"
 * }
 * </pre>
 * It uses a registry keyed by the {@code type} value.
 */
public final class SpaceFactory {

    private static final Map<String, ISpaceCreator> registry = new HashMap<>();

    static {
        register("grid", config -> new GridSpace(intExtent(config), periodic(config), metric(config)));
        register("grid-single", config -> new GridSpaceSingle(intExtent(config), periodic(config), metric(config)));
        register("continuous", config -> new ContinuousSpace(doubleExtent(config), periodic(config)));
        register("graph", config -> {
            GraphSpace graph = new GraphSpace(config.getInt("nodes"));
            if (config.hasPath("edges")) {
                for (List<Object> edge : edgeList(config)) {
                    graph.addEdge(((Number) edge.get(0)).intValue(), ((Number) edge.get(1)).intValue());
                }
            }
            return graph;
        });
    }

    private SpaceFactory() {}

    /**
     * Registers a new space creator.
     * @param type The type name used in configuration.
     * @param creator The creator for the space.
     */
    public static void register(String type, ISpaceCreator creator) {
        registry.put(type.toLowerCase(Locale.ROOT), creator);
    }

    /**
     * Creates a new space.
     * @param config The space block; must contain {@code type}.
     * @return The created space.
     * @throws IllegalArgumentException if the space type is unknown.
     */
    public static ISpace<?> create(Config config) {
        Objects.requireNonNull(config, "Space config cannot be null.");
        String type = config.getString("type");
        ISpaceCreator creator = registry.get(type.toLowerCase(Locale.ROOT));
        if (creator == null) {
            throw new IllegalArgumentException("Unknown space type: " + type);
        }
        return creator.create(config);
    }

    private static int[] intExtent(Config config) {
        return config.getIntList("extent").stream().mapToInt(Integer::intValue).toArray();
    }

    private static double[] doubleExtent(Config config) {
        return config.getDoubleList("extent").stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static boolean periodic(Config config) {
        return !config.hasPath("periodic") || config.getBoolean("periodic");
    }

    private static Metric metric(Config config) {
        return config.hasPath("metric") ? Metric.fromString(config.getString("metric")) : Metric.CHEBYSHEV;
    }

    @SuppressWarnings("unchecked")
    private static List<List<Object>> edgeList(Config config) {
        return (List<List<Object>>) (List<?>) config.getList("edges").unwrapped();
    }
}
