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


package com.danielgmyers.switchboard.ex;

import java.util.Objects;

/**
 * A single problem found while validating a flow.
 */
public final class FlowViolation {

    private final ViolationType type;
    private final Severity severity;
    private final String nodeId;
    private final String message;

    /**
     * @param type     What kind of problem this is.
     * @param severity The effective severity; differs from the type's default only in strict mode.
     * @param nodeId   The node the problem originates from, or null if it can't be attributed to one node.
     * @param message  A human-readable description.
     */
    public FlowViolation(ViolationType type, Severity severity, String nodeId, String message) {
        if (type == null || severity == null || message == null) {
            throw new IllegalArgumentException("type, severity and message are required.");
        }
        this.type = type;
        this.severity = severity;
        this.nodeId = nodeId;
        this.message = message;
    }

    public static FlowViolation of(ViolationType type, String nodeId, String message) {
        return new FlowViolation(type, type.getDefaultSeverity(), nodeId, message);
    }

    public ViolationType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * Null if the violation is not attributable to a single node (e.g. the flow has no start node).
     */
    public String getNodeId() {
        return nodeId;
    }

    public String getMessage() {
        return message;
    }

    public boolean isFatal() {
        return severity == Severity.STRUCTURAL;
    }

    /**
     * Returns a copy of this violation with STRUCTURAL severity.
     */
    public FlowViolation promote() {
        if (isFatal()) {
            return this;
        }
        return new FlowViolation(type, Severity.STRUCTURAL, nodeId, message);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        FlowViolation that = (FlowViolation) other;
        return type == that.type && severity == that.severity && Objects.equals(nodeId, that.nodeId)
               && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, nodeId, message);
    }

    @Override
    public String toString() {
        if (nodeId == null) {
            return String.format("%s %s: %s", severity, type, message);
        }
        return String.format("%s %s at %s: %s", severity, type, nodeId, message);
    }
}
