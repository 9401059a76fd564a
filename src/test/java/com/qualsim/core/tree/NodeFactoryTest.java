package com.qualsim.core.tree;

import com.qualsim.core.engine.NodeStatus;
import com.qualsim.core.engine.TransitionEngine;
import com.qualsim.core.engine.TransitionResult;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.AttributeValue;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import com.qualsim.core.space.Trend;
import com.qualsim.support.Flashlight;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.qualsim.support.Flashlight.LEVEL;
import static org.junit.jupiter.api.Assertions.*;

class NodeFactoryTest {

    private final SimulationScope scope = Flashlight.scope();
    private final TransitionEngine engine = Flashlight.engine();
    private SimulationGraph graph;
    private NodeFactory factory;

    @BeforeEach
    void setUp() {
        graph = new SimulationGraph("sim-test", "flashlight", List.of(ActionRequest.of("recharge")));
        factory = new NodeFactory(graph);
    }

    private TransitionResult recharge(WorldSnapshot snapshot) {
        return engine.apply(snapshot, Flashlight.action(scope, "recharge"), Map.of(), scope).get(0);
    }

    @Nested
    @DisplayName("placement")
    class Placement {

        @Test
        @DisplayName("root is state0 on layer 0")
        void root() {
            TreeNode root = factory.createRoot(Flashlight.initial(scope));

            assertEquals("state0", root.id());
            assertEquals(0, root.layer());
            assertTrue(root.isRoot());
            assertThrows(IllegalStateException.class, () -> factory.createRoot(Flashlight.initial(scope)));
        }

        @Test
        @DisplayName("equivalent results of one layer merge into one node with two edges")
        void mergeWithinLayer() {
            TreeNode root = factory.createRoot(Flashlight.initial(scope));
            factory.beginLayer(1);
            TreeNode low = factory.place(root, ActionRequest.of("recharge"), recharge(Flashlight.withLevels(scope, "low"))).node();
            NodeFactory.Placement second = factory.place(root, ActionRequest.of("recharge"),
                    recharge(Flashlight.withLevels(scope, "high")));

            assertTrue(second.merged());
            assertSame(low, second.node());
            assertEquals(2, low.incomingEdges().size());
            assertTrue(low.isMerged());
            assertEquals(List.of("state0"), low.parentIds());
            assertEquals(List.of("state1"), root.childIds());
            assertEquals(2, graph.size());
        }

        @Test
        @DisplayName("nothing merges across layers")
        void noMergeAcrossLayers() {
            TreeNode root = factory.createRoot(Flashlight.initial(scope));
            factory.beginLayer(1);
            TreeNode first = factory.place(root, ActionRequest.of("recharge"), recharge(Flashlight.withLevels(scope, "low"))).node();
            factory.beginLayer(2);
            NodeFactory.Placement again = factory.place(first, ActionRequest.of("recharge"), recharge(first.snapshot()));

            assertFalse(again.merged());
            assertEquals("state2", again.node().id());
            assertEquals(2, again.node().layer());
        }

        @Test
        @DisplayName("different status keeps otherwise equal snapshots apart")
        void statusSeparates() {
            TreeNode root = factory.createRoot(Flashlight.initial(scope));
            factory.beginLayer(1);
            WorldSnapshot snapshot = Flashlight.withLevels(scope, "empty");
            TransitionResult ok = new TransitionResult(NodeStatus.OK, snapshot, snapshot, List.of(), List.of(),
                    List.of(), List.of(), null, false);
            TransitionResult rejected = new TransitionResult(NodeStatus.REJECTED, snapshot, snapshot, List.of(),
                    List.of(), List.of(), List.of(), null, false);

            factory.place(root, ActionRequest.of("turn_on"), ok);

            assertFalse(factory.place(root, ActionRequest.of("turn_on"), rejected).merged());
        }

        @Test
        @DisplayName("error results never merge")
        void errorsNeverMerge() {
            TreeNode root = factory.createRoot(Flashlight.initial(scope));
            factory.beginLayer(1);
            TransitionResult fatal = TransitionResult.fatal(root.snapshot(), "boom");

            factory.place(root, ActionRequest.of("explode"), fatal);
            NodeFactory.Placement second = factory.place(root, ActionRequest.of("explode"), fatal);

            assertFalse(second.merged());
            assertEquals(NodeStatus.ERROR, second.node().status());
            assertEquals("boom", second.node().error());
            assertEquals(root.snapshot(), second.node().snapshot());
        }
    }

    @Nested
    @DisplayName("fingerprint")
    class FingerprintTests {

        @Test
        @DisplayName("does not depend on attribute insertion order")
        void insertionOrder() {
            WorldSnapshot snapshot = Flashlight.initial(scope);
            List<Map.Entry<AttributePath, AttributeValue>> entries = new ArrayList<>(snapshot.values().entrySet());
            Collections.reverse(entries);
            Map<AttributePath, AttributeValue> reversed = new LinkedHashMap<>();
            entries.forEach(e -> reversed.put(e.getKey(), e.getValue()));

            assertEquals(Fingerprint.of(snapshot), Fingerprint.of(new WorldSnapshot(reversed)));
        }

        @Test
        @DisplayName("distinguishes level sets and trends")
        void distinguishes() {
            WorldSnapshot snapshot = Flashlight.withLevels(scope, "high");
            WorldSnapshot trending = snapshot.with(LEVEL, snapshot.value(LEVEL).withTrend(Trend.DOWN));

            assertNotEquals(Fingerprint.of(snapshot), Fingerprint.of(Flashlight.withLevels(scope, "full")));
            assertNotEquals(Fingerprint.of(snapshot), Fingerprint.of(trending));
            assertEquals(32, Fingerprint.of(snapshot).length());
        }
    }

    @Test
    @DisplayName("action requests parse parameters")
    void actionRequestParsing() {
        ActionRequest request = ActionRequest.parse("set_mode:mode=eco");

        assertEquals("set_mode", request.name());
        assertEquals(Map.of("mode", "eco"), request.parameters());
        assertEquals("set_mode:mode=eco", request.toString());
        assertEquals(ActionRequest.of("turn_on"), ActionRequest.parse(" turn_on "));
        assertThrows(IllegalArgumentException.class, () -> ActionRequest.parse("set_mode:eco"));
    }
}
