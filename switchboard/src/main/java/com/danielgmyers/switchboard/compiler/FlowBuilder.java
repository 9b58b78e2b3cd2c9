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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import com.danielgmyers.switchboard.FlowCompilerConfig;
import com.danielgmyers.switchboard.IdentifierValidation;
import com.danielgmyers.switchboard.ex.FlowUsageException;
import com.danielgmyers.switchboard.ex.FlowValidationException;
import com.danielgmyers.switchboard.ex.FlowViolation;
import com.danielgmyers.switchboard.flow.ActionKind;
import com.danielgmyers.switchboard.flow.ActionNode;
import com.danielgmyers.switchboard.flow.ErrorTypes;
import com.danielgmyers.switchboard.flow.FallbackTrigger;
import com.danielgmyers.switchboard.flow.FlowGraph;
import com.danielgmyers.switchboard.values.AttributeReferences;
import com.danielgmyers.switchboard.values.FlowValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a contact flow one statement at a time.
 *
 * Each statement creates one or more nodes. A new node receives every edge that is still waiting for a target
 * at this level: normally just the previous node's next edge, but after a branch also the ends of every case body
 * that fell through. Terminal actions (transfer, disconnect) and jumps leave nothing waiting, so the statement
 * after them is only reachable through a label.
 *
 * Case bodies get their own builder, which shares the node counter and label table with this one. While a case
 * body runs, only its builder may be used.
 *
 * A builder is not thread-safe, but builders for different flows share no state and may be used in parallel.
 */
public class FlowBuilder {

    private static final Logger log = LoggerFactory.getLogger(FlowBuilder.class);

    public static final String COMPARISON_VALUE_PARAMETER = "ComparisonValue";

    // These kinds only make sense with their cases attached, so they have dedicated statements.
    private static final Set<ActionKind> CASE_DRIVEN_KINDS
            = EnumSet.of(ActionKind.BRANCH, ActionKind.SPEECH_INPUT, ActionKind.CHECK_HOURS);

    private final FlowCompilation compilation;
    private final ContinuationScope scope;
    private final boolean root;
    private boolean closed;

    public FlowBuilder() {
        this(new FlowCompilerConfig());
    }

    public FlowBuilder(FlowCompilerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config may not be null.");
        }
        this.compilation = new FlowCompilation(config);
        this.scope = new ContinuationScope("root");
        this.root = true;
        this.closed = false;
        compilation.getScopes().push(scope);
    }

    private FlowBuilder(FlowCompilation compilation, ContinuationScope scope) {
        this.compilation = compilation;
        this.scope = scope;
        this.root = false;
        this.closed = false;
        compilation.getScopes().push(scope);
    }

    public NodeHandle append(ActionKind kind) {
        return append(kind, Collections.emptyMap());
    }

    public NodeHandle append(ActionKind kind, Map<String, ?> parameters) {
        return append(kind, parameters, null);
    }

    /**
     * Appends a node of the given kind.
     * @param kind       The kind of action. Branches, speech inputs and hours checks have their own statements.
     * @param parameters The node's parameters; values are converted with FlowValues. May be empty.
     * @param label      If not null, a label to bind to the new node.
     * @return A handle for the new node.
     */
    public NodeHandle append(ActionKind kind, Map<String, ?> parameters, String label) {
        return appendNode(null, kind, parameters, label);
    }

    /**
     * Like append, but uses the given id for the node instead of generating one.
     * Duplicate ids are reported when the flow is built.
     */
    public NodeHandle appendWithId(String id, ActionKind kind, Map<String, ?> parameters, String label) {
        if (id == null) {
            throw new FlowUsageException("Explicit node ids must not be null.");
        }
        return appendNode(id, kind, parameters, label);
    }

    public NodeHandle prompt(String text) {
        return append(ActionKind.PROMPT, Collections.singletonMap("Text", text));
    }

    public NodeHandle setAttributes(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            throw new FlowUsageException("setAttributes needs at least one attribute.");
        }
        return append(ActionKind.SET_ATTRIBUTES, attributes);
    }

    /**
     * Sets the queue a later transfer will use. The queue reference is passed through to the runtime unchecked.
     */
    public NodeHandle setQueue(String queueRef) {
        return append(ActionKind.SET_QUEUE, Collections.singletonMap("QueueId", queueRef));
    }

    public NodeHandle setLogging(boolean enabled) {
        return append(ActionKind.SET_LOGGING, Collections.singletonMap("FlowLoggingBehavior",
                                                                       enabled ? "Enabled" : "Disabled"));
    }

    /**
     * Invokes a function. The function reference (usually an ARN) is passed through to the runtime unchecked.
     */
    public NodeHandle invoke(String functionRef, long timeoutSeconds) {
        if (timeoutSeconds < 1) {
            throw new FlowUsageException("Function invocation timeouts must be at least one second.");
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("LambdaFunctionARN", functionRef);
        parameters.put("InvocationTimeLimitSeconds", timeoutSeconds);
        return append(ActionKind.INVOKE, parameters);
    }

    public NodeHandle transferToQueue() {
        return append(ActionKind.TRANSFER);
    }

    public NodeHandle disconnect() {
        return append(ActionKind.DISCONNECT);
    }

    private NodeHandle appendNode(String explicitId, ActionKind kind, Map<String, ?> parameters, String label) {
        requireUsable();
        if (kind == null) {
            throw new FlowUsageException("Action kind may not be null.");
        }
        if (CASE_DRIVEN_KINDS.contains(kind)) {
            throw new FlowUsageException(kind + " nodes must be created with branch, sequentialInput"
                                         + " or checkHoursOfOperation.");
        }
        Map<String, String> converted = FlowValues.toRuntimeStrings(parameters == null ? Collections.emptyMap()
                                                                                       : parameters);
        if (label != null) {
            compilation.checkLabelAvailable(label);
        }

        DraftNode node = createAndLink(explicitId, kind, converted);
        if (!kind.isTerminal()) {
            scope.add(DanglingTail.next(node));
        }

        NodeHandle handle = new NodeHandle(compilation, node);
        if (label != null) {
            handle.label(label);
        }
        return handle;
    }

    /**
     * Branches on a contact attribute. Cases are tried in order and the first match wins.
     * @param attributeRef The attribute to compare, e.g. "$.Attributes.Tier".
     * @param cases        At least one case.
     * @param otherwise    Runs when no case matches. Pass an empty body to continue after the branch;
     *                     pass null to leave the no-match path unhandled (reported as a warning).
     */
    public void branch(String attributeRef, List<BranchCase> cases, Consumer<FlowBuilder> otherwise) {
        requireUsable();
        AttributeReferences.validate(attributeRef);
        if (cases == null || cases.isEmpty()) {
            throw new FlowUsageException("A branch on " + attributeRef + " needs at least one case.");
        }
        if (cases.stream().anyMatch(Objects::isNull)) {
            throw new FlowUsageException("Branch cases must not be null.");
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put(COMPARISON_VALUE_PARAMETER, attributeRef);
        DraftNode marker = createAndLink(null, ActionKind.BRANCH, parameters);

        openCases(marker, cases, marker.getId());
        if (otherwise != null) {
            runCaseBody(marker, Collections.singletonList(marker.addError(ErrorTypes.NO_MATCHING_CONDITION)),
                        otherwise, "otherwise", marker.getId());
        }
    }

    /**
     * Branches without an otherwise body.
     */
    public void branch(String attributeRef, List<BranchCase> cases) {
        branch(attributeRef, cases, null);
    }

    /**
     * Asks the caller a question, listening for speech first and falling back to the keypad.
     * Always creates exactly two nodes, the speech node first.
     * @return A handle for the speech node.
     */
    public NodeHandle sequentialInput(SequentialInput input) {
        requireUsable();
        if (input == null) {
            throw new FlowUsageException("input may not be null.");
        }
        if (input.getIntentCases().isEmpty() && input.getDigitCases().isEmpty()) {
            throw new FlowUsageException("A sequential input needs at least one intent or digit case.");
        }
        if (input.getDtmfLabel() != null) {
            compilation.checkLabelAvailable(input.getDtmfLabel());
        }

        DraftNode speech = createAndLink(null, ActionKind.SPEECH_INPUT,
                                         input.getSpeechConfig().toParameters(input.getPromptText()));
        DraftNode dtmf = compilation.createNode(null, ActionKind.INPUT,
                                                input.getDtmfConfig().toParameters(input.getPromptText()));
        compilation.registerFallbackPair(speech, dtmf);
        if (input.getDtmfLabel() != null) {
            compilation.bindLabel(input.getDtmfLabel(), dtmf);
        }

        for (FallbackTrigger trigger : input.getFallbackTriggers()) {
            speech.assign(speech.addError(trigger.getErrorType()), TargetRef.node(dtmf.getId()));
        }
        log.debug("Sequential input {} falls back to {} on {}.", speech.getId(), dtmf.getId(),
                  input.getFallbackTriggers());

        openCases(speech, input.getIntentCases(), speech.getId());
        openCases(dtmf, input.getDigitCases(), speech.getId());
        if (input.getOtherwise() != null) {
            List<EdgeSlot> failureSlots = Arrays.asList(dtmf.addError(ErrorTypes.NO_MATCHING_CONDITION),
                                                        dtmf.addError(ErrorTypes.INPUT_TIME_LIMIT_EXCEEDED),
                                                        dtmf.addError(ErrorTypes.NO_MATCHING_ERROR));
            runCaseBody(dtmf, failureSlots, input.getOtherwise(), "otherwise", speech.getId());
        }

        return new NodeHandle(compilation, speech);
    }

    /**
     * Checks the contact's hours of operation and runs one of two bodies.
     * The hours reference is passed through to the runtime unchecked.
     */
    public NodeHandle checkHoursOfOperation(String hoursRef, Consumer<FlowBuilder> inHours,
                                            Consumer<FlowBuilder> outOfHours) {
        requireUsable();
        List<BranchCase> cases = Arrays.asList(BranchCase.when(true, inHours), BranchCase.when(false, outOfHours));
        Map<String, String> parameters = FlowValues.toRuntimeStrings(Collections.singletonMap("Hours", hoursRef));

        DraftNode node = createAndLink(null, ActionKind.CHECK_HOURS, parameters);
        openCases(node, cases, node.getId());
        return new NodeHandle(compilation, node);
    }

    /**
     * Sends everything waiting at this point to the node bound to the label. The label may be bound later in the
     * program. Like a terminal action, a jump leaves nothing for the next statement to pick up.
     */
    public void jumpTo(String label) {
        requireUsable();
        IdentifierValidation.validateLabel(label);
        if (scope.isEmpty()) {
            throw new FlowUsageException("Nothing leads to the jump to " + label + ": it follows a terminal action"
                                         + " or another jump, or the flow has no nodes yet.");
        }
        List<DanglingTail> tails = scope.drain();
        for (DanglingTail tail : tails) {
            tail.patch(TargetRef.label(label));
        }
        log.debug("Jump to {} in scope {} resolves {}", label, scope.getName(), tails);
    }

    /**
     * Validates the flow and returns the finished graph.
     * @throws FlowValidationException if validation finds any fatal problem; it carries every violation found.
     */
    public FlowGraph build() {
        if (!root) {
            throw new FlowUsageException("Only the root builder can build the flow.");
        }
        requireUsable();

        closed = true;
        compilation.getScopes().pop(scope);
        compilation.seal(scope.drain());

        List<FlowViolation> violations = new FlowValidator(compilation.getConfig().isStrictMode()).validate(compilation);
        List<FlowViolation> fatal = violations.stream().filter(FlowViolation::isFatal).collect(Collectors.toList());
        for (FlowViolation violation : violations) {
            if (violation.isFatal()) {
                log.error("Flow validation: {}", violation);
            } else {
                log.warn("Flow validation: {}", violation);
            }
        }
        if (!fatal.isEmpty()) {
            throw new FlowValidationException(violations);
        }

        List<ActionNode> frozen = compilation.getNodes().stream()
                                             .map(n -> n.freeze(compilation::resolve))
                                             .collect(Collectors.toList());
        return new FlowGraph(compilation.getStart().getId(), frozen, violations);
    }

    private DraftNode createAndLink(String explicitId, ActionKind kind, Map<String, String> parameters) {
        DraftNode node = compilation.createNode(explicitId, kind, parameters);
        List<DanglingTail> tails = scope.drain();
        for (DanglingTail tail : tails) {
            tail.patch(TargetRef.node(node.getId()));
        }
        log.debug("Created {} in scope {}, resolving {}", node, scope.getName(), tails);
        return node;
    }

    private void openCases(DraftNode node, List<BranchCase> cases, String joinOrigin) {
        for (BranchCase branchCase : cases) {
            EdgeSlot slot = node.addCondition(branchCase.getCondition());
            runCaseBody(node, Collections.singletonList(slot), branchCase.getBody(),
                        branchCase.getCondition().toString(), joinOrigin);
        }
    }

    /**
     * Runs one case body in its own scope. The scope starts out holding the edges that enter the case, so the
     * body's first node picks them up; whatever the body leaves waiting joins this builder's scope.
     */
    private void runCaseBody(DraftNode node, List<EdgeSlot> entrySlots, Consumer<FlowBuilder> body,
                             String caseName, String joinOrigin) {
        ContinuationScope caseScope = new ContinuationScope(scope.getName() + "/" + node.getId() + ":" + caseName);
        for (EdgeSlot slot : entrySlots) {
            caseScope.add(new DanglingTail(node, slot, joinOrigin));
        }

        FlowBuilder caseBuilder = new FlowBuilder(compilation, caseScope);
        List<DanglingTail> fallThrough;
        try {
            body.accept(caseBuilder);
        } finally {
            fallThrough = caseBuilder.close();
        }

        for (DanglingTail tail : fallThrough) {
            scope.add(tail.joinedAt(joinOrigin));
        }
    }

    private List<DanglingTail> close() {
        closed = true;
        compilation.getScopes().pop(scope);
        return scope.drain();
    }

    private void requireUsable() {
        compilation.requireOpen();
        if (closed) {
            throw new FlowUsageException("The builder for scope " + scope.getName() + " can no longer be used.");
        }
        compilation.getScopes().requireInnermost(scope);
    }
}
