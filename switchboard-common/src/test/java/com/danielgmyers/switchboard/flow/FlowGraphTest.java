/*
 *   Copyright Flux Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */


package com.danielgmyers.switchboard.flow;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.danielgmyers.switchboard.ex.FlowViolation;
import com.danielgmyers.switchboard.ex.ViolationType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FlowGraphTest {

    private static ActionNode node(String id, ActionKind kind, NodeRef next) {
        return new ActionNode(id, kind, Collections.emptyMap(),
                              new Transitions(next, Collections.emptyList(), Collections.emptyList()));
    }

    @Test
    public void testNodesKeepCreationOrder() {
        ActionNode first = node("b", ActionKind.PROMPT, NodeRef.to("a"));
        ActionNode second = node("a", ActionKind.DISCONNECT, null);
        FlowViolation warning = FlowViolation.of(ViolationType.UNREACHABLE_NODE, "a", "x");

        FlowGraph graph = new FlowGraph("b", List.of(first, second), List.of(warning));
        Assertions.assertEquals(List.of("b", "a"), List.copyOf(graph.getNodes().keySet()));
        Assertions.assertSame(first, graph.getStartNode());
        Assertions.assertSame(second, graph.getNode("a"));
        Assertions.assertEquals(2, graph.size());
        Assertions.assertEquals(List.of(warning), graph.getWarnings());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> graph.getNodes().remove("a"));
    }

    @Test
    public void testRejectsDuplicatesAndMissingStart() {
        ActionNode a = node("a", ActionKind.DISCONNECT, null);
        Assertions.assertThrows(IllegalArgumentException.class,
                                () -> new FlowGraph("a", List.of(a, a), Collections.emptyList()));
        Assertions.assertThrows(IllegalArgumentException.class,
                                () -> new FlowGraph("z", List.of(a), Collections.emptyList()));
        Assertions.assertThrows(IllegalArgumentException.class,
                                () -> new FlowGraph(null, List.of(a), Collections.emptyList()));
    }

    @Test
    public void testTransitionTargetsInOrder() {
        Transitions transitions = new Transitions(NodeRef.to("n"),
                List.of(new ConditionTransition(Condition.of(ComparisonOperator.EQUALS, "1"), NodeRef.to("c"))),
                List.of(new ErrorTransition(ErrorTypes.NO_MATCHING_CONDITION, NodeRef.to("e"))));
        Assertions.assertEquals(List.of(NodeRef.to("n"), NodeRef.to("c"), NodeRef.to("e")),
                                transitions.getAllTargets());
        Assertions.assertEquals("n", transitions.getNext().get().getTargetId());

        Transitions terminal = new Transitions(null, Collections.emptyList(), Collections.emptyList());
        Assertions.assertFalse(terminal.getNext().isPresent());
        Assertions.assertTrue(terminal.getAllTargets().isEmpty());
    }

    @Test
    public void testFallbackTriggersMapToDistinctErrorTypes() {
        Assertions.assertEquals(ErrorTypes.INPUT_TIME_LIMIT_EXCEEDED, FallbackTrigger.TIMEOUT.getErrorType());
        Assertions.assertEquals(ErrorTypes.NO_MATCHING_CONDITION, FallbackTrigger.NO_MATCH.getErrorType());
        long distinct = Arrays.stream(FallbackTrigger.values()).map(FallbackTrigger::getErrorType)
                                        .distinct().count();
        Assertions.assertEquals(FallbackTrigger.values().length, distinct);
    }
}
