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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.stream.Collectors;

import com.danielgmyers.switchboard.ex.FlowViolation;
import com.danielgmyers.switchboard.ex.Severity;
import com.danielgmyers.switchboard.ex.ViolationType;
import com.danielgmyers.switchboard.flow.ActionKind;
import com.danielgmyers.switchboard.flow.ErrorTypes;

/**
 * Structural and semantic checks run once over a sealed flow. Every check runs regardless of what the
 * earlier ones found, so the caller sees all problems at once.
 */
final class FlowValidator {

    /**
     * The flow runtime rejects flows with more actions than this.
     */
    static final int MAX_ACTIONS = 250;

    /**
     * A branch whose cases fall through with no statement after it is rejected rather than implicitly terminated.
     */
    static final Severity UNRESOLVED_CONTINUATION_SEVERITY = Severity.STRUCTURAL;

    private final boolean strictMode;

    FlowValidator(boolean strictMode) {
        this.strictMode = strictMode;
    }

    /**
     * Returns every violation found: structural ones first, then warnings (promoted to structural in strict mode).
     */
    List<FlowViolation> validate(FlowCompilation compilation) {
        if (!compilation.isSealed()) {
            throw new IllegalStateException("Flows must be sealed before they are validated.");
        }

        List<FlowViolation> violations = new ArrayList<>();
        checkStart(compilation, violations);
        Set<String> duplicateIds = checkDuplicateIds(compilation, violations);
        checkNodeCount(compilation, violations);
        checkReferences(compilation, violations);
        checkContinuations(compilation, violations);

        List<FlowViolation> warnings = new ArrayList<>();
        checkOtherwise(compilation, warnings);
        Set<String> unusedFallbacks = checkFallbacks(compilation, warnings);
        checkReachability(compilation, duplicateIds, unusedFallbacks, warnings);

        for (FlowViolation warning : warnings) {
            violations.add(strictMode ? warning.promote() : warning);
        }
        return violations;
    }

    private void checkStart(FlowCompilation compilation, List<FlowViolation> violations) {
        if (compilation.getStart() == null) {
            violations.add(FlowViolation.of(ViolationType.MISSING_START, null, "The flow has no nodes, so it has no start."));
        }
    }

    private Set<String> checkDuplicateIds(FlowCompilation compilation, List<FlowViolation> violations) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DraftNode node : compilation.getNodes()) {
            counts.merge(node.getId(), 1, Integer::sum);
        }
        Set<String> duplicates = new LinkedHashSet<>();
        for (Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > 1) {
                duplicates.add(entry.getKey());
                violations.add(FlowViolation.of(ViolationType.DUPLICATE_ID, entry.getKey(),
                        String.format("%d nodes share the id %s.", entry.getValue(), entry.getKey())));
            }
        }
        return duplicates;
    }

    private void checkNodeCount(FlowCompilation compilation, List<FlowViolation> violations) {
        int count = compilation.getNodes().size();
        if (count > MAX_ACTIONS) {
            violations.add(FlowViolation.of(ViolationType.NODE_LIMIT_EXCEEDED, null,
                    String.format("The flow has %d actions but at most %d are allowed.", count, MAX_ACTIONS)));
        }
    }

    private void checkReferences(FlowCompilation compilation, List<FlowViolation> violations) {
        Set<String> ids = compilation.getNodes().stream().map(DraftNode::getId).collect(Collectors.toSet());
        for (DraftNode node : compilation.getNodes()) {
            for (TargetRef target : node.getAssignedTargets()) {
                if (target.isLabel()) {
                    if (compilation.resolve(target) == null) {
                        violations.add(FlowViolation.of(ViolationType.UNRESOLVED_LABEL, node.getId(),
                                "Node " + node.getId() + " refers to label " + target.getLabel()
                                + ", which is never bound."));
                    }
                } else if (!ids.contains(target.getNodeId())) {
                    violations.add(FlowViolation.of(ViolationType.UNRESOLVED_REFERENCE, node.getId(),
                            "Node " + node.getId() + " refers to node " + target.getNodeId() + ", which does not exist."));
                }
            }
        }
    }

    private void checkContinuations(FlowCompilation compilation, List<FlowViolation> violations) {
        Map<String, List<DanglingTail>> tailsByOrigin = new LinkedHashMap<>();
        for (DanglingTail tail : compilation.getUnresolvedTails()) {
            tailsByOrigin.computeIfAbsent(tail.getJoinOrigin(), k -> new ArrayList<>()).add(tail);
        }
        for (Entry<String, List<DanglingTail>> entry : tailsByOrigin.entrySet()) {
            String message = String.format("Node %s has paths that continue after it (%s), but no statement follows it."
                                           + " End those paths with a terminal action or a jump, or add a statement"
                                           + " after it.", entry.getKey(), entry.getValue());
            violations.add(new FlowViolation(ViolationType.UNRESOLVED_CONTINUATION, UNRESOLVED_CONTINUATION_SEVERITY,
                                             entry.getKey(), message));
        }
    }

    private void checkOtherwise(FlowCompilation compilation, List<FlowViolation> warnings) {
        for (DraftNode node : compilation.getNodes()) {
            if (node.getKind() == ActionKind.BRANCH && !node.getErrorTypes().contains(ErrorTypes.NO_MATCHING_CONDITION)) {
                warnings.add(FlowViolation.of(ViolationType.MISSING_OTHERWISE, node.getId(),
                        "Branch " + node.getId() + " has no otherwise case; contacts that match no case are dropped."));
            }
        }
    }

    /**
     * A keypad fallback counts as used if any other node leads to it: its speech input's fallback triggers,
     * or a jump to its label.
     */
    private Set<String> checkFallbacks(FlowCompilation compilation, List<FlowViolation> warnings) {
        Set<String> referenced = new HashSet<>();
        for (DraftNode node : compilation.getNodes()) {
            for (TargetRef target : node.getAssignedTargets()) {
                String id = compilation.resolve(target);
                if (id != null && !id.equals(node.getId())) {
                    referenced.add(id);
                }
            }
        }

        Set<String> unused = new HashSet<>();
        for (Entry<String, String> pair : compilation.getFallbackNodesBySpeechNode().entrySet()) {
            if (!referenced.contains(pair.getValue())) {
                unused.add(pair.getValue());
                warnings.add(FlowViolation.of(ViolationType.UNUSED_FALLBACK, pair.getValue(),
                        "Speech input " + pair.getKey() + " has no fallback triggers and nothing jumps to its keypad"
                        + " fallback " + pair.getValue() + ", so the fallback is never used."));
            }
        }
        return unused;
    }

    private void checkReachability(FlowCompilation compilation, Set<String> duplicateIds, Set<String> alreadyReported,
                                   List<FlowViolation> warnings) {
        if (compilation.getStart() == null) {
            return;
        }
        Map<String, DraftNode> nodesById = firstNodeById(compilation);

        Set<DraftNode> reachable = new HashSet<>();
        Deque<DraftNode> pending = new ArrayDeque<>();
        pending.add(compilation.getStart());
        while (!pending.isEmpty()) {
            DraftNode node = pending.poll();
            if (!reachable.add(node)) {
                continue;
            }
            for (TargetRef target : node.getAssignedTargets()) {
                String id = compilation.resolve(target);
                if (id != null && nodesById.containsKey(id)) {
                    pending.add(nodesById.get(id));
                }
            }
        }

        for (DraftNode node : compilation.getNodes()) {
            if (!reachable.contains(node) && !duplicateIds.contains(node.getId())
                    && !alreadyReported.contains(node.getId())) {
                warnings.add(FlowViolation.of(ViolationType.UNREACHABLE_NODE, node.getId(),
                        "Node " + node.getId() + " cannot be reached from the start of the flow."));
            }
        }
    }

    private static Map<String, DraftNode> firstNodeById(FlowCompilation compilation) {
        Map<String, DraftNode> nodesById = new HashMap<>();
        for (DraftNode node : compilation.getNodes()) {
            nodesById.putIfAbsent(node.getId(), node);
        }
        return nodesById;
    }
}
