package org.abmkit.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.junit.extensions.logging.LogWatchExtension;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.container.ContainerKind;
import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.scheduler.ByType;
import org.abmkit.runtime.scheduler.IScheduler;
import org.abmkit.runtime.scheduler.Partially;
import org.abmkit.runtime.scheduler.SchedulerFactory;
import org.abmkit.runtime.scheduler.Schedulers;
import org.abmkit.runtime.space.GridSpaceSingle;
import org.abmkit.runtime.space.ISpace;
import org.abmkit.runtime.testing.TestAgents.GridWalker;
import org.abmkit.runtime.testing.TestAgents.Plain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ModelSettingsTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("abmkit.model.seed");
        System.clearProperty("abmkit.model.scheduler.type");
        System.clearProperty("abmkit.model.scheduler.fraction");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void referenceDefaults() {
        ModelSettings settings = ModelSettings.load();

        assertThat(settings.getContainer()).isEqualTo(ContainerKind.MAPPING);
        assertThat(settings.isWarn()).isTrue();
        assertThat(settings.getSeed()).isEmpty();
        assertThat(settings.getSchedulerType()).isEqualTo("fastest");
        assertThat(settings.createScheduler()).isSameAs(Schedulers.fastest());
        assertThat(settings.hasSpace()).isFalse();
        assertThat(settings.getProperties().isEmpty()).isTrue();
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("abmkit.model.seed", "99");
        ConfigFactory.invalidateCaches();

        assertThat(ModelSettings.load().getSeed()).hasValue(99L);
    }

    @Test
    void fileLayerSitsBetweenPropertiesAndDefaults(@TempDir Path dir) throws Exception {
        File file = dir.resolve("abmkit.conf").toFile();
        Files.writeString(file.toPath(), "abmkit.model { container = sequence, seed = 5 }");
        System.setProperty("abmkit.model.seed", "6");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file).getConfig(ModelSettings.MODEL_PATH);

        assertThat(config.getString("container")).isEqualTo("sequence");
        assertThat(config.getLong("seed")).isEqualTo(6L);
        assertThat(config.getString("scheduler.type")).isEqualTo("fastest");
    }

    @Test
    void buildsConfiguredModel() {
        ModelSettings settings = ModelSettings.fromConfig(ConfigFactory.parseString("""
                container = sequence
                warn = false
                seed = 17
                scheduler { type = partially, fraction = 0.5 }
                space { type = grid-single, extent = [4, 4], periodic = false }
                properties { rate = 0.3 }
                """));

        AgentBasedModel<GridWalker, ISpace<?>> model = settings.builder(GridWalker.class).build();
        for (int i = 0; i < 10; i++) {
            model.addNew(id -> new GridWalker(id, 1 + (id - 1) % 4, 1 + (id - 1) / 4));
        }

        assertThat(model.getContainerKind()).isEqualTo(ContainerKind.SEQUENCE);
        assertThat(model.getSpace()).isInstanceOf(GridSpaceSingle.class);
        assertThat(model.getRandomProvider().getSeed()).isEqualTo(17L);
        assertThat(model.getProperties().getDouble("rate")).isEqualTo(0.3);
        assertThat(model.schedule().toIntArray()).hasSize(5);
    }

    @Test
    void schedulerParametersFromSystemPropertiesAreParsed() {
        System.setProperty("abmkit.model.scheduler.type", "partially");
        System.setProperty("abmkit.model.scheduler.fraction", "0.5");
        ConfigFactory.invalidateCaches();

        assertThat(ModelSettings.load().createScheduler())
                .isInstanceOfSatisfying(Partially.class, p -> assertThat(p.getFraction()).isEqualTo(0.5));
    }

    @Test
    void quotedSchedulerParametersAreParsed() {
        ModelSettings settings = ModelSettings.fromConfig(ConfigFactory.parseString(
                "scheduler { type = by-type, shuffle-types = \"true\", shuffle-agents = \"off\" }"));

        assertThat(settings.createScheduler()).isInstanceOfSatisfying(ByType.class, b -> {
            assertThat(b.isShuffleTypes()).isTrue();
            assertThat(b.isShuffleAgents()).isFalse();
        });
    }

    @Test
    void eachBuilderGetsItsOwnScheduler() {
        SchedulerFactory.register("growing-prefix", params -> new GrowingPrefix());
        ModelSettings settings = ModelSettings.fromConfig(ConfigFactory.parseString(
                "scheduler { type = growing-prefix }"));

        AgentBasedModel<Plain, ISpace<?>> first = settings.builder(Plain.class).build();
        AgentBasedModel<Plain, ISpace<?>> second = settings.builder(Plain.class).build();
        for (int i = 0; i < 3; i++) {
            first.addNew(Plain::new);
            second.addNew(Plain::new);
        }

        assertThat(first.getScheduler()).isNotSameAs(second.getScheduler());
        assertThat(first.schedule().toIntArray()).containsExactly(1);
        assertThat(second.schedule().toIntArray()).containsExactly(1);
        assertThat(first.schedule().toIntArray()).containsExactly(1, 2);
    }

    @Test
    void eachBuilderGetsItsOwnSpace() {
        ModelSettings settings = ModelSettings.fromConfig(ConfigFactory.parseString(
                "space { type = grid-single, extent = [2, 2] }"));

        AgentBasedModel<GridWalker, ISpace<?>> first = settings.builder(GridWalker.class).build();
        AgentBasedModel<GridWalker, ISpace<?>> second = settings.builder(GridWalker.class).build();
        first.add(new GridWalker(1, 1, 1));
        second.add(new GridWalker(1, 1, 1));

        assertThat(first.getSpace()).isNotSameAs(second.getSpace());
    }

    @Test
    void applyToLeavesSpaceAlone() {
        ModelSettings settings = ModelSettings.fromConfig(ConfigFactory.parseString(
                "scheduler { type = by-id }, space { type = graph, nodes = 3 }"));

        AgentBasedModel<Plain, ISpace<?>> model = settings.applyTo(AgentBasedModel.builder(Plain.class)).build();
        model.add(new Plain(2));
        model.add(new Plain(1));

        assertThat(model.hasSpace()).isFalse();
        assertThat(model.schedule().toIntArray()).containsExactly(1, 2);
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThatThrownBy(() -> ModelSettings.fromConfig(ConfigFactory.parseString("container = array")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("array");
        assertThatThrownBy(() -> ModelSettings.fromConfig(ConfigFactory.parseString("scheduler { type = lottery }")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelSettings.fromConfig(ConfigFactory.parseString("space { type = torus }")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Activates one more agent per call.
     */
    private static final class GrowingPrefix implements IScheduler<Agent> {
        private int calls = 0;

        @Override
        public IntList schedule(AgentBasedModel<? extends Agent, ?> model) {
            calls++;
            IntList ids = model.ids();
            return ids.subList(0, Math.min(calls, ids.size()));
        }
    }
}
