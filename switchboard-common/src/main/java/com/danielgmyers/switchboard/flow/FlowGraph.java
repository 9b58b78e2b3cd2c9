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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.switchboard.ex.FlowViolation;

/**
 * A validated, fully-wired contact flow. Construct one using FlowBuilder.
 *
 * Nodes are kept in creation order, which is also the order they are serialized in.
 */
public final class FlowGraph {

    private final String startId;
    private final Map<String, ActionNode> nodes;
    private final List<FlowViolation> warnings;

    /**
     * Only meant to be called by the flow builder once validation has passed.
     */
    public FlowGraph(String startId, List<ActionNode> nodes, List<FlowViolation> warnings) {
        if (startId == null) {
            throw new IllegalArgumentException("A flow graph must have a start node.");
        }
        Map<String, ActionNode> byId = new LinkedHashMap<>();
        for (ActionNode node : nodes) {
            if (byId.put(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id " + node.getId());
            }
        }
        if (!byId.containsKey(startId)) {
            throw new IllegalArgumentException("Start node " + startId + " is not part of the graph.");
        }
        this.startId = startId;
        this.nodes = Collections.unmodifiableMap(byId);
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public String getStartId() {
        return startId;
    }

    public ActionNode getStartNode() {
        return nodes.get(startId);
    }

    public Map<String, ActionNode> getNodes() {
        return nodes;
    }

    public ActionNode getNode(String id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Non-fatal problems found when the graph was validated.
     */
    public List<FlowViolation> getWarnings() {
        return warnings;
    }
}
