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


package com.danielgmyers.switchboard.ex;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FlowViolationTest {

    @Test
    public void testDefaultSeverityComesFromType() {
        FlowViolation structural = FlowViolation.of(ViolationType.DUPLICATE_ID, "prompt-0001", "dup");
        Assertions.assertEquals(Severity.STRUCTURAL, structural.getSeverity());
        Assertions.assertTrue(structural.isFatal());

        FlowViolation warning = FlowViolation.of(ViolationType.UNREACHABLE_NODE, "prompt-0002", "unreachable");
        Assertions.assertEquals(Severity.WARNING, warning.getSeverity());
        Assertions.assertFalse(warning.isFatal());
    }

    @Test
    public void testPromote() {
        FlowViolation warning = FlowViolation.of(ViolationType.MISSING_OTHERWISE, "compare-0002", "no otherwise");
        FlowViolation promoted = warning.promote();
        Assertions.assertTrue(promoted.isFatal());
        Assertions.assertEquals(warning.getType(), promoted.getType());
        Assertions.assertEquals(warning.getNodeId(), promoted.getNodeId());
        Assertions.assertEquals(warning.getMessage(), promoted.getMessage());
        Assertions.assertNotEquals(warning, promoted);

        Assertions.assertSame(promoted, promoted.promote());
    }

    @Test
    public void testToStringIncludesNodeWhenKnown() {
        Assertions.assertEquals("STRUCTURAL MISSING_START: empty",
                                FlowViolation.of(ViolationType.MISSING_START, null, "empty").toString());
        Assertions.assertEquals("WARNING UNREACHABLE_NODE at a: b",
                                FlowViolation.of(ViolationType.UNREACHABLE_NODE, "a", "b").toString());
    }

    @Test
    public void testValidationExceptionSeparatesFatalViolations() {
        FlowViolation fatal = FlowViolation.of(ViolationType.UNRESOLVED_LABEL, "prompt-0001", "missing label");
        FlowViolation warning = FlowViolation.of(ViolationType.UNREACHABLE_NODE, "prompt-0002", "unreachable");

        FlowValidationException e = new FlowValidationException(List.of(fatal, warning));
        Assertions.assertEquals(List.of(fatal, warning), e.getViolations());
        Assertions.assertEquals(List.of(fatal), e.getFatalViolations());
        Assertions.assertTrue(e.getMessage().contains("1 fatal violation"), e.getMessage());
        Assertions.assertTrue(e instanceof FlowBuildException);
    }
}
