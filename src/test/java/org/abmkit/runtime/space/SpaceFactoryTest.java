package org.abmkit.runtime.space;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SpaceFactoryTest {

    @Test
    void gridDefaultsToPeriodicChebyshev() {
        ISpace<?> space = SpaceFactory.create(ConfigFactory.parseString("type = grid, extent = [4, 6]"));

        assertThat(space).isInstanceOfSatisfying(GridSpace.class, grid -> {
            assertThat(grid.getExtent()).containsExactly(4, 6);
            assertThat(grid.isPeriodic()).isTrue();
            assertThat(grid.getMetric()).isEqualTo(Metric.CHEBYSHEV);
        });
    }

    @Test
    void configuredGridMatchesDirectConstruction() {
        AbstractGridSpace configured = (AbstractGridSpace) SpaceFactory.create(ConfigFactory.parseString(
                "type = grid-single, extent = [5, 5], periodic = false, metric = manhattan"));
        GridSpaceSingle direct = new GridSpaceSingle(new int[]{5, 5}, false, Metric.MANHATTAN);

        assertThat(configured).isInstanceOf(GridSpaceSingle.class);
        assertThat(configured.toString()).isEqualTo(direct.toString());
        assertThat(configured.offsetsAtRadius(2)).hasSameSizeAs(direct.offsetsAtRadius(2));
        assertThat(configured.normalizePosition(new int[]{9, 0})).containsExactly(5, 1);
    }

    @Test
    void continuousAndGraphSpaces() {
        ISpace<?> continuous = SpaceFactory.create(ConfigFactory.parseString("type = continuous, extent = [1.5, 2]"));
        ISpace<?> graph = SpaceFactory.create(ConfigFactory.parseString("type = graph, nodes = 3, edges = [[1, 2], [2, 3]]"));

        assertThat(continuous).isInstanceOfSatisfying(ContinuousSpace.class,
                c -> assertThat(c.getExtent()).containsExactly(1.5, 2.0));
        assertThat(graph).isInstanceOfSatisfying(GraphSpace.class,
                g -> assertThat(g.neighbors(2).toIntArray()).containsExactly(1, 3));
    }

    @Test
    void invalidBlocksAreRejected() {
        assertThatThrownBy(() -> SpaceFactory.create(ConfigFactory.parseString("type = hexagonal")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hexagonal");
        assertThatThrownBy(() -> SpaceFactory.create(ConfigFactory.parseString("type = grid")))
                .isInstanceOf(ConfigException.Missing.class);
        assertThatThrownBy(() -> SpaceFactory.create(ConfigFactory.parseString("type = grid, extent = [3], metric = taxicab")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("taxicab");
    }
}
