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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.danielgmyers.switchboard.flow.ActionKind;
import com.danielgmyers.switchboard.flow.ActionNode;
import com.danielgmyers.switchboard.flow.Condition;
import com.danielgmyers.switchboard.flow.ConditionTransition;
import com.danielgmyers.switchboard.flow.ErrorTransition;
import com.danielgmyers.switchboard.flow.NodeRef;
import com.danielgmyers.switchboard.flow.Transitions;

/**
 * The mutable form of an action node, used only while the flow is being built.
 * Edge targets start out unassigned and are filled in exactly once, when the builder learns where they lead.
 */
final class DraftNode {

    private final String id;
    private final ActionKind kind;
    private final Map<String, String> parameters;

    private TargetRef next;
    private final List<Condition> conditions = new ArrayList<>();
    private final List<TargetRef> conditionTargets = new ArrayList<>();
    private final List<String> errorTypes = new ArrayList<>();
    private final List<TargetRef> errorTargets = new ArrayList<>();

    DraftNode(String id, ActionKind kind, Map<String, String> parameters) {
        this.id = id;
        this.kind = kind;
        this.parameters = new LinkedHashMap<>(parameters);
    }

    String getId() {
        return id;
    }

    ActionKind getKind() {
        return kind;
    }

    Map<String, String> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * Adds a condition edge with no target yet and returns its slot.
     */
    EdgeSlot addCondition(Condition condition) {
        conditions.add(condition);
        conditionTargets.add(null);
        return EdgeSlot.condition(conditions.size() - 1);
    }

    /**
     * Adds an error edge with no target yet and returns its slot.
     */
    EdgeSlot addError(String errorType) {
        errorTypes.add(errorType);
        errorTargets.add(null);
        return EdgeSlot.error(errorTypes.size() - 1);
    }

    List<String> getErrorTypes() {
        return Collections.unmodifiableList(errorTypes);
    }

    TargetRef getTarget(EdgeSlot slot) {
        switch (slot.getType()) {
            case NEXT:
                return next;
            case CONDITION:
                return conditionTargets.get(slot.getIndex());
            case ERROR:
                return errorTargets.get(slot.getIndex());
            default:
                throw new IllegalArgumentException("Unrecognized edge slot: " + slot);
        }
    }

    /**
     * Points the given edge at a target. An edge can only be assigned once; a second assignment means the builder
     * lost track of a continuation, which is a bug rather than a problem with the caller's program.
     */
    void assign(EdgeSlot slot, TargetRef target) {
        if (getTarget(slot) != null) {
            throw new IllegalStateException(String.format("Edge %s of node %s is already assigned to %s.",
                                                          slot, id, getTarget(slot)));
        }
        switch (slot.getType()) {
            case NEXT:
                next = target;
                break;
            case CONDITION:
                conditionTargets.set(slot.getIndex(), target);
                break;
            case ERROR:
                errorTargets.set(slot.getIndex(), target);
                break;
            default:
                throw new IllegalArgumentException("Unrecognized edge slot: " + slot);
        }
    }

    /**
     * All assigned targets, in next / conditions / errors order.
     */
    List<TargetRef> getAssignedTargets() {
        List<TargetRef> targets = new ArrayList<>();
        if (next != null) {
            targets.add(next);
        }
        for (TargetRef target : conditionTargets) {
            if (target != null) {
                targets.add(target);
            }
        }
        for (TargetRef target : errorTargets) {
            if (target != null) {
                targets.add(target);
            }
        }
        return targets;
    }

    /**
     * Produces the immutable node. Condition and error edges that never got a target are dropped;
     * the validator has already refused to build a flow in which that matters.
     */
    ActionNode freeze(Function<TargetRef, String> resolver) {
        NodeRef frozenNext = next == null ? null : NodeRef.to(resolver.apply(next));

        List<ConditionTransition> frozenConditions = new ArrayList<>();
        for (int i = 0; i < conditions.size(); i++) {
            TargetRef target = conditionTargets.get(i);
            if (target != null) {
                frozenConditions.add(new ConditionTransition(conditions.get(i), NodeRef.to(resolver.apply(target))));
            }
        }

        List<ErrorTransition> frozenErrors = new ArrayList<>();
        for (int i = 0; i < errorTypes.size(); i++) {
            TargetRef target = errorTargets.get(i);
            if (target != null) {
                frozenErrors.add(new ErrorTransition(errorTypes.get(i), NodeRef.to(resolver.apply(target))));
            }
        }

        return new ActionNode(id, kind, parameters, new Transitions(frozenNext, frozenConditions, frozenErrors));
    }

    @Override
    public String toString() {
        return kind + "(" + id + ")";
    }
}
