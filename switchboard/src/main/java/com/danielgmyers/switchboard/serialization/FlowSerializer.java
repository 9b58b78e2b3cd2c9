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

import java.util.Map;

import com.danielgmyers.switchboard.flow.ActionNode;
import com.danielgmyers.switchboard.flow.ConditionTransition;
import com.danielgmyers.switchboard.flow.ErrorTransition;
import com.danielgmyers.switchboard.flow.FlowGraph;
import com.danielgmyers.switchboard.flow.Transitions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes a flow graph as a flow document.
 *
 * Actions appear in the order their nodes were created, and every object's fields are written in a fixed order
 * with "\n" line endings, so the same graph always produces the same bytes on every platform.
 */
public class FlowSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final ObjectWriter WRITER;

    static {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        // "Key": "value", rather than Jackson's default "Key" : "value".
        Separators separators = Separators.createDefaultInstance()
                                          .withObjectFieldValueSpacing(Separators.Spacing.AFTER);
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter().withSeparators(separators);
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        WRITER = MAPPER.writer(printer);
    }

    private final String version;

    public FlowSerializer(String version) {
        if (version == null || version.isEmpty()) {
            throw new IllegalArgumentException("version may not be blank.");
        }
        this.version = version;
    }

    /**
     * Generates the flow document for the given graph.
     */
    public String serialize(FlowGraph graph) {
        try {
            return WRITER.writeValueAsString(toTree(graph));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Unable to serialize flow graph.", e);
        }
    }

    /**
     * Builds the document as a Jackson tree without rendering it.
     */
    public ObjectNode toTree(FlowGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph may not be null.");
        }
        ObjectNode document = MAPPER.createObjectNode();
        document.put("Version", version);
        document.put("StartAction", graph.getStartId());

        ArrayNode actions = document.putArray("Actions");
        for (ActionNode node : graph.getNodes().values()) {
            actions.add(toTree(node));
        }
        return document;
    }

    private ObjectNode toTree(ActionNode node) {
        ObjectNode action = MAPPER.createObjectNode();
        action.put("Identifier", node.getId());
        action.put("Type", node.getKind().getRuntimeType());

        ObjectNode parameters = action.putObject("Parameters");
        for (Map.Entry<String, String> parameter : node.getParameters().entrySet()) {
            parameters.put(parameter.getKey(), parameter.getValue());
        }

        Transitions transitions = node.getTransitions();
        ObjectNode transitionsNode = action.putObject("Transitions");
        transitions.getNext().ifPresent(next -> transitionsNode.put("NextAction", next.getTargetId()));

        ArrayNode conditions = transitionsNode.putArray("Conditions");
        for (ConditionTransition transition : transitions.getConditions()) {
            ObjectNode conditionNode = conditions.addObject();
            conditionNode.put("NextAction", transition.getTarget().getTargetId());
            ObjectNode predicate = conditionNode.putObject("Condition");
            predicate.put("Operator", transition.getCondition().getOperator().getRuntimeName());
            ArrayNode operands = predicate.putArray("Operands");
            transition.getCondition().getOperands().forEach(operands::add);
        }

        ArrayNode errors = transitionsNode.putArray("Errors");
        for (ErrorTransition transition : transitions.getErrors()) {
            ObjectNode errorNode = errors.addObject();
            errorNode.put("NextAction", transition.getTarget().getTargetId());
            errorNode.put("ErrorType", transition.getErrorType());
        }
        return action;
    }
}
