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

import java.util.Objects;

public final class ConditionTransition {

    private final Condition condition;
    private final NodeRef target;

    public ConditionTransition(Condition condition, NodeRef target) {
        if (condition == null || target == null) {
            throw new IllegalArgumentException("condition and target are required.");
        }
        this.condition = condition;
        this.target = target;
    }

    public Condition getCondition() {
        return condition;
    }

    public NodeRef getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        ConditionTransition that = (ConditionTransition) other;
        return condition.equals(that.condition) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, target);
    }
}
