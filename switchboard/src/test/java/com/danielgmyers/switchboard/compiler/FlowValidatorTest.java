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


package com.danielgmyers.switchboard.compiler;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.danielgmyers.switchboard.FlowCompilerConfig;
import com.danielgmyers.switchboard.ex.FlowValidationException;
import com.danielgmyers.switchboard.ex.FlowViolation;
import com.danielgmyers.switchboard.ex.Severity;
import com.danielgmyers.switchboard.ex.ViolationType;
import com.danielgmyers.switchboard.flow.ActionKind;
import com.danielgmyers.switchboard.flow.FlowGraph;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FlowValidatorTest {

    private static FlowBuilder chain(int size) {
        FlowBuilder flow = new FlowBuilder();
        for (int i = 0; i < size; i++) {
            flow.prompt("Message " + i);
        }
        return flow;
    }

    private static List<ViolationType> types(List<FlowViolation> violations) {
        return violations.stream().map(FlowViolation::getType).collect(Collectors.toList());
    }

    @Test
    public void testNodeLimit() {
        FlowGraph graph = chain(FlowValidator.MAX_ACTIONS).build();
        Assertions.assertEquals(250, graph.size());

        FlowValidationException e = Assertions.assertThrows(FlowValidationException.class,
                                                            () -> chain(FlowValidator.MAX_ACTIONS + 1).build());
        Assertions.assertEquals(List.of(ViolationType.NODE_LIMIT_EXCEEDED), types(e.getViolations()));
        Assertions.assertNull(e.getViolations().get(0).getNodeId());
    }

    @Test
    public void testAllViolationsAreReportedTogether() {
        FlowBuilder flow = new FlowBuilder();
        flow.appendWithId("greeting", ActionKind.PROMPT, Map.of("Text", "Hi"), null);
        flow.appendWithId("greeting", ActionKind.PROMPT, Map.of("Text", "Hi again"), null);
        flow.jumpTo("missing");

        FlowValidationException e = Assertions.assertThrows(FlowValidationException.class, () -> flow.build());
        List<ViolationType> found = types(e.getFatalViolations());
        Assertions.assertTrue(found.size() >= 2, found.toString());
        Assertions.assertTrue(found.contains(ViolationType.DUPLICATE_ID));
        Assertions.assertTrue(found.contains(ViolationType.UNRESOLVED_LABEL));
    }

    @Test
    public void testStructuralViolationsComeBeforeWarnings() {
        FlowBuilder flow = new FlowBuilder();
        flow.branch("$.Attributes.Tier", List.of(BranchCase.jump("gold", "nowhere")));
        flow.disconnect();

        FlowValidationException e = Assertions.assertThrows(FlowValidationException.class, () -> flow.build());
        Assertions.assertEquals(List.of(ViolationType.UNRESOLVED_LABEL, ViolationType.MISSING_OTHERWISE,
                                        ViolationType.UNREACHABLE_NODE),
                                types(e.getViolations()));
        Assertions.assertEquals(List.of(ViolationType.UNRESOLVED_LABEL), types(e.getFatalViolations()));
    }

    @Test
    public void testReferenceToMissingNode() {
        FlowCompilation compilation = new FlowCompilation(new FlowCompilerConfig());
        DraftNode node = compilation.createNode(null, ActionKind.PROMPT, Collections.emptyMap());
        node.assign(EdgeSlot.next(), TargetRef.node("ghost"));
        compilation.seal(Collections.emptyList());

        List<FlowViolation> violations = new FlowValidator(false).validate(compilation);
        Assertions.assertEquals(List.of(ViolationType.UNRESOLVED_REFERENCE), types(violations));
        Assertions.assertEquals(node.getId(), violations.get(0).getNodeId());
    }

    @Test
    public void testUnsealedCompilationIsRejected() {
        FlowCompilation compilation = new FlowCompilation(new FlowCompilerConfig());
        Assertions.assertThrows(IllegalStateException.class, () -> new FlowValidator(false).validate(compilation));
    }

    @Test
    public void testUnresolvedContinuationsAreFatal() {
        Assertions.assertEquals(Severity.STRUCTURAL, FlowValidator.UNRESOLVED_CONTINUATION_SEVERITY);
        Assertions.assertEquals(Severity.STRUCTURAL, ViolationType.UNRESOLVED_CONTINUATION.getDefaultSeverity());
    }

    @Test
    public void testStrictModePromotesOnlyWarnings() {
        FlowBuilder flow = new FlowBuilder();
        flow.disconnect();
        flow.prompt("Orphan");

        FlowGraph graph = flow.build();
        Assertions.assertEquals(List.of(ViolationType.UNREACHABLE_NODE), types(graph.getWarnings()));
        Assertions.assertEquals(Severity.WARNING, graph.getWarnings().get(0).getSeverity());

        FlowCompilerConfig config = new FlowCompilerConfig();
        config.setStrictMode(true);
        FlowBuilder strict = new FlowBuilder(config);
        strict.disconnect();
        strict.prompt("Orphan");
        FlowValidationException e = Assertions.assertThrows(FlowValidationException.class, () -> strict.build());
        Assertions.assertEquals(Severity.STRUCTURAL, e.getViolations().get(0).getSeverity());
    }
}
