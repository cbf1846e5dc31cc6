package org.abmkit.runtime.space;

import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.testing.TestAgents.NodeAgent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GraphSpaceTest {

    @Test
    void edgesAreUndirectedAndDeduplicated() {
        GraphSpace graph = new GraphSpace(3);
        graph.addEdge(1, 2);
        graph.addEdge(2, 1);
        graph.addEdge(2, 3);

        assertThat(graph.neighbors(2).toIntArray()).containsExactly(1, 3);
        assertThat(graph.neighbors(1).toIntArray()).containsExactly(2);
        assertThatThrownBy(() -> graph.addEdge(0, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void agentsMoveBetweenNodes() {
        AgentBasedModel<NodeAgent, GraphSpace> model = AgentBasedModel.builder(NodeAgent.class)
                .space(new GraphSpace(3))
                .build();
        NodeAgent agent = model.add(new NodeAgent(1, 1));
        model.add(new NodeAgent(2, 1));

        model.moveAgent(agent, 3);

        assertThat(agent.getPos()).isEqualTo(3);
        assertThat(model.getSpace().idsInPosition(1).toIntArray()).containsExactly(2);
        assertThat(model.getSpace().idsInPosition(3).toIntArray()).containsExactly(1);
        assertThatThrownBy(() -> model.add(new NodeAgent(3, 4))).isInstanceOf(IllegalArgumentException.class);
    }
}
