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

/**
 * A reference from a transition to the node it leads to.
 */
public final class NodeRef {

    private final String targetId;

    private NodeRef(String targetId) {
        this.targetId = targetId;
    }

    public static NodeRef to(String targetId) {
        if (targetId == null || targetId.isEmpty()) {
            throw new IllegalArgumentException("A node reference must name a node.");
        }
        return new NodeRef(targetId);
    }

    public String getTargetId() {
        return targetId;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return targetId.equals(((NodeRef) other).targetId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetId);
    }

    @Override
    public String toString() {
        return "->" + targetId;
    }
}
