package org.abmkit.runtime.space;

import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.testing.TestAgents.Particle;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ContinuousSpaceTest {

    @Test
    void periodicNormalizationWraps() {
        ContinuousSpace space = new ContinuousSpace(new double[]{1, 1}, true);

        double[] pos = space.normalizePosition(new double[]{1.2, -0.3});
        assertThat(pos[0]).isCloseTo(0.2, within(1e-12));
        assertThat(pos[1]).isCloseTo(0.7, within(1e-12));
    }

    @Test
    void boundedNormalizationClampsBelowExtent() {
        ContinuousSpace space = new ContinuousSpace(new double[]{1, 1}, false);

        double[] pos = space.normalizePosition(new double[]{1.2, -0.3});
        assertThat(pos).containsExactly(Math.nextDown(1.0), 0.0);
        assertThat(pos[0]).isLessThan(1.0);
    }

    @Test
    void wrappedPositionNeverReachesExtent() {
        ContinuousSpace space = new ContinuousSpace(new double[]{10}, true);

        assertThat(space.normalizePosition(new double[]{-1e-18})[0]).isGreaterThanOrEqualTo(0.0).isLessThan(10.0);
        assertThat(space.normalizePosition(new double[]{10.0})[0]).isEqualTo(0.0);
    }

    @Test
    void nearbyIdsUsesMinimumImage() {
        AgentBasedModel<Particle, ContinuousSpace> model = AgentBasedModel.builder(Particle.class)
                .space(new ContinuousSpace(new double[]{10, 10}, true))
                .build();
        model.add(new Particle(1, new double[]{0.5, 5}, new double[]{1, 0}));
        model.add(new Particle(2, new double[]{9.5, 5}, new double[]{1, 0}));
        model.add(new Particle(3, new double[]{5, 5}, new double[]{1, 0}));

        assertThat(model.getSpace().nearbyIds(new double[]{0.2, 5}, 1.0, model).toIntArray()).containsExactly(1, 2);
        assertThat(model.getSpace().nearbyIds(new double[]{5, 5}, 0.0, model).toIntArray()).containsExactly(3);
    }

    @Test
    void placementOutsideIsRejected() {
        ContinuousSpace space = new ContinuousSpace(new double[]{2, 2}, false);

        assertThatThrownBy(() -> space.validatePlacement(new double[]{2.0, 1.0})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> space.validatePlacement(new double[]{Double.NaN, 1.0})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ContinuousSpace(new double[]{0, 1}, true)).isInstanceOf(IllegalArgumentException.class);
    }
}
