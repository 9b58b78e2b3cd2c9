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

import java.util.function.Consumer;

import com.danielgmyers.switchboard.IdentifierValidation;
import com.danielgmyers.switchboard.ex.FlowUsageException;
import com.danielgmyers.switchboard.flow.ComparisonOperator;
import com.danielgmyers.switchboard.flow.Condition;
import com.danielgmyers.switchboard.values.FlowValues;

/**
 * One case of a branch: a condition and the body to run when it matches.
 *
 * The case value is converted to its runtime string form as soon as the case is created, so an unsupported
 * value type fails at the line that declares the case.
 */
public final class BranchCase {

    private final Condition condition;
    private final Consumer<FlowBuilder> body;

    private BranchCase(Condition condition, Consumer<FlowBuilder> body) {
        this.condition = condition;
        this.body = body;
    }

    /**
     * A case that matches when the compared attribute equals the value.
     */
    public static BranchCase when(Object value, Consumer<FlowBuilder> body) {
        return when(ComparisonOperator.EQUALS, value, body);
    }

    public static BranchCase when(ComparisonOperator operator, Object value, Consumer<FlowBuilder> body) {
        if (operator == null) {
            throw new FlowUsageException("Branch cases need an operator.");
        }
        if (body == null) {
            throw new FlowUsageException("Branch cases need a body; use BranchCase.jump to go to a label instead.");
        }
        return new BranchCase(Condition.of(operator, FlowValues.toRuntimeString(value)), body);
    }

    /**
     * A case whose body is a bare reference to a labelled node.
     */
    public static BranchCase jump(Object value, String label) {
        return jump(ComparisonOperator.EQUALS, value, label);
    }

    public static BranchCase jump(ComparisonOperator operator, Object value, String label) {
        IdentifierValidation.validateLabel(label);
        return when(operator, value, flow -> flow.jumpTo(label));
    }

    public Condition getCondition() {
        return condition;
    }

    Consumer<FlowBuilder> getBody() {
        return body;
    }
}
