package org.abmkit.config;

import com.typesafe.config.Config;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.container.ContainerKind;
import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.model.ModelProperties;
import org.abmkit.runtime.scheduler.IScheduler;
import org.abmkit.runtime.scheduler.SchedulerFactory;
import org.abmkit.runtime.space.ISpace;
import org.abmkit.runtime.space.SpaceFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Model settings read from an {@code abmkit.model} block:
 * <pre>
 * abmkit.model {
 *   container = "mapping"
 *   warn = true
 *   seed = 42
 *   scheduler { type = "partially", fraction = 0.5 }
 *   space { type = "grid", extent = [10, 10] }
 *   properties { growth = 0.1 }
 * }
 * </pre>
 * Every key but {@code scheduler.type} is optional.
 */
public final class ModelSettings {

    public static final String MODEL_PATH = "abmkit.model";

    private final ContainerKind container;
    private final boolean warn;
    private final OptionalLong seed;
    private final String schedulerType;
    private final Map<String, Object> schedulerParams;
    private final Config spaceConfig;
    private final ModelProperties properties;

    private ModelSettings(ContainerKind container, boolean warn, OptionalLong seed, String schedulerType,
                          Map<String, Object> schedulerParams, Config spaceConfig, ModelProperties properties) {
        this.container = container;
        this.warn = warn;
        this.seed = seed;
        this.schedulerType = schedulerType;
        this.schedulerParams = schedulerParams;
        this.spaceConfig = spaceConfig;
        this.properties = properties;
    }

    /**
     * Reads the {@code abmkit.model} block of the configuration returned by {@link ConfigLoader#load()}.
     */
    public static ModelSettings load() {
        return fromConfig(ConfigLoader.load().getConfig(MODEL_PATH));
    }

    /**
     * @param model the model block itself, not the root configuration
     * @throws IllegalArgumentException on unknown container, scheduler or space types
     */
    public static ModelSettings fromConfig(Config model) {
        Objects.requireNonNull(model, "model config");
        ContainerKind container = model.hasPath("container")
                ? ContainerKind.fromString(model.getString("container"))
                : ContainerKind.MAPPING;
        boolean warn = !model.hasPath("warn") || model.getBoolean("warn");
        OptionalLong seed = model.hasPath("seed") ? OptionalLong.of(model.getLong("seed")) : OptionalLong.empty();

        String schedulerType = "fastest";
        Map<String, Object> schedulerParams = Map.of();
        if (model.hasPath("scheduler")) {
            Config schedulerConfig = model.getConfig("scheduler");
            schedulerType = schedulerConfig.getString("type");
            Map<String, Object> params = new HashMap<>(schedulerConfig.root().unwrapped());
            params.remove("type");
            schedulerParams = Collections.unmodifiableMap(params);
        }
        // validate eagerly
        SchedulerFactory.create(schedulerType, schedulerParams);

        Config spaceConfig = null;
        if (model.hasPath("space")) {
            spaceConfig = model.getConfig("space");
            // validate eagerly
            SpaceFactory.create(spaceConfig);
        }
        ModelProperties properties = model.hasPath("properties")
                ? ModelProperties.fromConfig(model.getConfig("properties"))
                : ModelProperties.empty();
        return new ModelSettings(container, warn, seed, schedulerType, schedulerParams, spaceConfig, properties);
    }

    /**
     * Applies everything but the space, which changes the builder's type; see {@link #builder(Class)}.
     * Each call gets its own scheduler instance.
     */
    public <A extends Agent, S extends ISpace<?>> AgentBasedModel.Builder<A, S> applyTo(AgentBasedModel.Builder<A, S> builder) {
        builder.container(container)
                .warn(warn)
                .scheduler(createScheduler())
                .properties(properties.copy());
        seed.ifPresent(builder::seed);
        return builder;
    }

    /**
     * A builder for {@code agentType} with all settings applied, including a fresh space if one
     * is configured.
     */
    public <A extends Agent> AgentBasedModel.Builder<A, ISpace<?>> builder(Class<A> agentType) {
        AgentBasedModel.Builder<A, ISpace<?>> builder = applyTo(AgentBasedModel.builder(agentType));
        ISpace<?> space = createSpace();
        if (space != null) {
            builder = builder.<ISpace<?>>space(space);
        }
        return builder;
    }

    public ContainerKind getContainer() {
        return container;
    }

    public boolean isWarn() {
        return warn;
    }

    public OptionalLong getSeed() {
        return seed;
    }

    public String getSchedulerType() {
        return schedulerType;
    }

    /**
     * @return a new instance of the configured scheduler
     */
    public IScheduler<Agent> createScheduler() {
        return SchedulerFactory.create(schedulerType, schedulerParams);
    }

    public boolean hasSpace() {
        return spaceConfig != null;
    }

    /**
     * @return a new, empty instance of the configured space, or {@code null} for a non-spatial model
     */
    public ISpace<?> createSpace() {
        return spaceConfig == null ? null : SpaceFactory.create(spaceConfig);
    }

    public ModelProperties getProperties() {
        return properties;
    }
}
