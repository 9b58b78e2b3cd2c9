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

/**
 * An edge whose target is not known yet: it will lead to whatever the enclosing builder creates next.
 *
 * joinOrigin is the id of the outermost branching node the tail has fallen through, or null for the plain
 * next edge of the most recent linear statement.
 */
final class DanglingTail {

    private final DraftNode node;
    private final EdgeSlot slot;
    private final String joinOrigin;

    DanglingTail(DraftNode node, EdgeSlot slot, String joinOrigin) {
        this.node = node;
        this.slot = slot;
        this.joinOrigin = joinOrigin;
    }

    static DanglingTail next(DraftNode node) {
        return new DanglingTail(node, EdgeSlot.next(), null);
    }

    DraftNode getNode() {
        return node;
    }

    String getNodeId() {
        return node.getId();
    }

    EdgeSlot getSlot() {
        return slot;
    }

    String getJoinOrigin() {
        return joinOrigin;
    }

    boolean isJoin() {
        return joinOrigin != null;
    }

    /**
     * The same tail, now attributed to a branch it fell out of.
     */
    DanglingTail joinedAt(String branchNodeId) {
        return new DanglingTail(node, slot, branchNodeId);
    }

    void patch(TargetRef target) {
        node.assign(slot, target);
    }

    @Override
    public String toString() {
        return node.getId() + "." + slot;
    }
}
