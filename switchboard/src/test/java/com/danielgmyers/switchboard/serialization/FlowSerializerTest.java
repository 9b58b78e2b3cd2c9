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


package com.danielgmyers.switchboard.serialization;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.danielgmyers.switchboard.compiler.BranchCase;
import com.danielgmyers.switchboard.compiler.FlowBuilder;
import com.danielgmyers.switchboard.flow.ActionKind;
import com.danielgmyers.switchboard.flow.FlowGraph;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class FlowSerializerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FlowSerializer serializer;

    @BeforeEach
    public void setup() {
        serializer = new FlowSerializer("2019-10-30");
    }

    private static FlowGraph buildScenario() {
        FlowBuilder flow = new FlowBuilder();
        flow.prompt("Hi");
        flow.branch("$.Attributes.Choice",
                    List.of(BranchCase.when("1", b -> b.append(ActionKind.TRANSFER, Map.of("QueueName", "Sales")))),
                    otherwise -> { });
        flow.disconnect();
        return flow.build();
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        return names;
    }

    @Test
    public void testOutputIsByteIdenticalAcrossRuns() {
        String first = serializer.serialize(buildScenario());
        String second = serializer.serialize(buildScenario());
        Assertions.assertEquals(first, second);
        Assertions.assertEquals(first, new FlowSerializer("2019-10-30").serialize(buildScenario()));
        Assertions.assertFalse(first.contains("\r"));
        Assertions.assertTrue(first.startsWith("{\n  \"Version\""), first);
    }

    @Test
    public void testFieldSeparatorHasNoLeadingSpace() {
        String json = serializer.serialize(buildScenario());
        Assertions.assertTrue(json.contains("\"Version\": \"2019-10-30\""), json);
        Assertions.assertTrue(json.contains("\"StartAction\": \"prompt-0001\""), json);
        Assertions.assertFalse(json.contains("\" : "), json);
    }

    @Test
    public void testDocumentLayout() throws Exception {
        JsonNode document = MAPPER.readTree(serializer.serialize(buildScenario()));

        Assertions.assertEquals(List.of("Version", "StartAction", "Actions"), fieldNames(document));
        Assertions.assertEquals("2019-10-30", document.get("Version").asText());
        Assertions.assertEquals("prompt-0001", document.get("StartAction").asText());

        JsonNode actions = document.get("Actions");
        Assertions.assertEquals(4, actions.size());
        Assertions.assertEquals(List.of("prompt-0001", "branch-0002", "transfer-0003", "disconnect-0004"),
                                Arrays.asList(actions.get(0).get("Identifier").asText(),
                                              actions.get(1).get("Identifier").asText(),
                                              actions.get(2).get("Identifier").asText(),
                                              actions.get(3).get("Identifier").asText()));

        JsonNode prompt = actions.get(0);
        Assertions.assertEquals(List.of("Identifier", "Type", "Parameters", "Transitions"), fieldNames(prompt));
        Assertions.assertEquals("MessageParticipant", prompt.get("Type").asText());
        Assertions.assertEquals("Hi", prompt.get("Parameters").get("Text").asText());
        Assertions.assertEquals(List.of("NextAction", "Conditions", "Errors"), fieldNames(prompt.get("Transitions")));
        Assertions.assertEquals("branch-0002", prompt.get("Transitions").get("NextAction").asText());

        JsonNode branch = actions.get(1);
        Assertions.assertEquals("Compare", branch.get("Type").asText());
        Assertions.assertEquals("$.Attributes.Choice", branch.get("Parameters").get("ComparisonValue").asText());
        JsonNode branchTransitions = branch.get("Transitions");
        Assertions.assertEquals(List.of("Conditions", "Errors"), fieldNames(branchTransitions));

        JsonNode condition = branchTransitions.get("Conditions").get(0);
        Assertions.assertEquals(List.of("NextAction", "Condition"), fieldNames(condition));
        Assertions.assertEquals("transfer-0003", condition.get("NextAction").asText());
        Assertions.assertEquals("Equals", condition.get("Condition").get("Operator").asText());
        Assertions.assertEquals("1", condition.get("Condition").get("Operands").get(0).asText());

        JsonNode error = branchTransitions.get("Errors").get(0);
        Assertions.assertEquals(List.of("NextAction", "ErrorType"), fieldNames(error));
        Assertions.assertEquals("disconnect-0004", error.get("NextAction").asText());
        Assertions.assertEquals("NoMatchingCondition", error.get("ErrorType").asText());
    }

    @Test
    public void testTerminalActionsHaveEmptyTransitions() throws Exception {
        JsonNode document = MAPPER.readTree(serializer.serialize(buildScenario()));
        JsonNode disconnect = document.get("Actions").get(3);

        Assertions.assertEquals("DisconnectParticipant", disconnect.get("Type").asText());
        Assertions.assertEquals(0, disconnect.get("Parameters").size());
        Assertions.assertFalse(disconnect.get("Transitions").has("NextAction"));
        Assertions.assertTrue(disconnect.get("Transitions").get("Conditions").isArray());
        Assertions.assertEquals(0, disconnect.get("Transitions").get("Conditions").size());
        Assertions.assertEquals(0, disconnect.get("Transitions").get("Errors").size());
    }

    @Test
    public void testCaseValuesAreWrittenAsRuntimeStrings() {
        FlowBuilder flow = new FlowBuilder();
        flow.branch("$.Attributes.Flag", Arrays.asList(BranchCase.jump(true, "end"), BranchCase.jump(false, "end"),
                                                       BranchCase.jump(42, "end")),
                    otherwise -> { });
        flow.append(ActionKind.DISCONNECT, Map.of(), "end");
        JsonNode conditions = serializer.toTree(flow.build()).get("Actions").get(0).get("Transitions").get("Conditions");

        Assertions.assertEquals("True", conditions.get(0).get("Condition").get("Operands").get(0).asText());
        Assertions.assertEquals("False", conditions.get(1).get("Condition").get("Operands").get(0).asText());
        Assertions.assertEquals("42", conditions.get(2).get("Condition").get("Operands").get(0).asText());
        Assertions.assertTrue(conditions.get(2).get("Condition").get("Operands").get(0).isTextual());
    }

    @Test
    public void testVersionIsConfigurable() {
        JsonNode document = new FlowSerializer("2020-01-01").toTree(buildScenario());
        Assertions.assertEquals("2020-01-01", document.get("Version").asText());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new FlowSerializer(""));
        Assertions.assertThrows(IllegalArgumentException.class, () -> serializer.serialize(null));
    }
}
