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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The outgoing edges of one action node. Conditions and errors keep the order they were declared in,
 * since the runtime tries conditions in order and the first match wins.
 */
public final class Transitions {

    private final NodeRef next;
    private final List<ConditionTransition> conditions;
    private final List<ErrorTransition> errors;

    public Transitions(NodeRef next, List<ConditionTransition> conditions, List<ErrorTransition> errors) {
        this.next = next;
        this.conditions = List.copyOf(conditions);
        this.errors = List.copyOf(errors);
    }

    public Optional<NodeRef> getNext() {
        return Optional.ofNullable(next);
    }

    public List<ConditionTransition> getConditions() {
        return conditions;
    }

    public List<ErrorTransition> getErrors() {
        return errors;
    }

    /**
     * Every target referenced by this node, in next / conditions / errors order.
     */
    public List<NodeRef> getAllTargets() {
        List<NodeRef> targets = new ArrayList<>();
        if (next != null) {
            targets.add(next);
        }
        Stream.concat(conditions.stream().map(ConditionTransition::getTarget),
                      errors.stream().map(ErrorTransition::getTarget))
              .forEach(targets::add);
        return targets;
    }
}
