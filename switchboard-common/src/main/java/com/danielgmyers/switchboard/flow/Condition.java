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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The predicate half of a conditional transition: an operator and its already-stringified operands.
 */
public final class Condition {

    private final ComparisonOperator operator;
    private final List<String> operands;

    public Condition(ComparisonOperator operator, List<String> operands) {
        if (operator == null) {
            throw new IllegalArgumentException("operator may not be null.");
        }
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("A condition needs at least one operand.");
        }
        this.operator = operator;
        this.operands = List.copyOf(operands);
    }

    public static Condition of(ComparisonOperator operator, String operand) {
        return new Condition(operator, Collections.singletonList(operand));
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public List<String> getOperands() {
        return operands;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Condition that = (Condition) other;
        return operator == that.operator && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operands);
    }

    @Override
    public String toString() {
        return operator.getRuntimeName() + operands;
    }
}
