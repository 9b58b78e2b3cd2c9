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

import java.util.Objects;

/**
 * Where a transition leads while the flow is still being built: either a node id that is already known,
 * or a label that may only be bound later in the program.
 */
final class TargetRef {

    private final String nodeId;
    private final String label;

    private TargetRef(String nodeId, String label) {
        this.nodeId = nodeId;
        this.label = label;
    }

    static TargetRef node(String nodeId) {
        return new TargetRef(nodeId, null);
    }

    static TargetRef label(String label) {
        return new TargetRef(null, label);
    }

    boolean isLabel() {
        return label != null;
    }

    String getNodeId() {
        return nodeId;
    }

    String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        TargetRef that = (TargetRef) other;
        return Objects.equals(nodeId, that.nodeId) && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, label);
    }

    @Override
    public String toString() {
        return isLabel() ? "label:" + label : nodeId;
    }
}
