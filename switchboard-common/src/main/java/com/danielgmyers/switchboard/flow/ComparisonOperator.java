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

/**
 * Operators the flow runtime can apply when comparing a contact attribute against a case value.
 * The enum constant's runtime name is what ends up in the "Operator" field of a condition.
 */
public enum ComparisonOperator {
    EQUALS("Equals"),
    NOT_EQUALS("NotEquals"),
    GREATER_THAN("GreaterThan"),
    LESS_THAN("LessThan"),
    GREATER_THAN_OR_EQUALS("GreaterThanOrEquals"),
    LESS_THAN_OR_EQUALS("LessThanOrEquals"),
    CONTAINS("Contains"),
    STARTS_WITH("StartsWith"),
    ENDS_WITH("EndsWith");

    private final String runtimeName;

    ComparisonOperator(String runtimeName) {
        this.runtimeName = runtimeName;
    }

    public String getRuntimeName() {
        return runtimeName;
    }
}
