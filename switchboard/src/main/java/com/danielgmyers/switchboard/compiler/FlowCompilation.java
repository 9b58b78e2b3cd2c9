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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.switchboard.FlowCompilerConfig;
import com.danielgmyers.switchboard.IdentifierValidation;
import com.danielgmyers.switchboard.ex.FlowUsageException;
import com.danielgmyers.switchboard.flow.ActionKind;

/**
 * State shared by a root builder and every nested case builder of one flow: the node list, the id counter,
 * the label table and the continuation-scope stack. Nothing here is shared between flows.
 */
final class FlowCompilation {

    private final FlowCompilerConfig config;
    private final NodeIdGenerator ids = new NodeIdGenerator();
    private final List<DraftNode> nodes = new ArrayList<>();
    private final Map<String, DraftNode> labels = new LinkedHashMap<>();
    private final Map<String, String> fallbackNodesBySpeechNode = new LinkedHashMap<>();
    private final ContinuationScopeStack scopes = new ContinuationScopeStack();
    private final List<DanglingTail> unresolvedTails = new ArrayList<>();

    private DraftNode start;
    private boolean sealed;

    FlowCompilation(FlowCompilerConfig config) {
        this.config = config;
    }

    FlowCompilerConfig getConfig() {
        return config;
    }

    ContinuationScopeStack getScopes() {
        return scopes;
    }

    /**
     * Creates a node without wiring anything to it. The first node ever created becomes the start node.
     */
    DraftNode createNode(String explicitId, ActionKind kind, Map<String, String> parameters) {
        requireOpen();
        String id;
        if (explicitId != null) {
            IdentifierValidation.validateNodeId(explicitId);
            ids.skip();
            id = explicitId;
        } else {
            id = ids.next(kind);
        }
        DraftNode node = new DraftNode(id, kind, parameters);
        nodes.add(node);
        if (start == null) {
            start = node;
        }
        return node;
    }

    void checkLabelAvailable(String label) {
        IdentifierValidation.validateLabel(label);
        if (labels.containsKey(label)) {
            throw new FlowUsageException(String.format("Label %s is already bound to node %s.",
                                                       label, labels.get(label).getId()));
        }
    }

    void bindLabel(String label, DraftNode node) {
        requireOpen();
        checkLabelAvailable(label);
        labels.put(label, node);
    }

    void registerFallbackPair(DraftNode speechNode, DraftNode dtmfNode) {
        fallbackNodesBySpeechNode.put(speechNode.getId(), dtmfNode.getId());
    }

    /**
     * Called once by the root builder's build method; after this no node, edge or label may be added.
     */
    void seal(List<DanglingTail> rootTails) {
        requireOpen();
        for (DanglingTail tail : rootTails) {
            if (tail.isJoin()) {
                unresolvedTails.add(tail);
            }
        }
        sealed = true;
    }

    boolean isSealed() {
        return sealed;
    }

    void requireOpen() {
        if (sealed) {
            throw new FlowUsageException("The flow has already been built; create a new builder to build another flow.");
        }
    }

    String resolve(TargetRef target) {
        if (!target.isLabel()) {
            return target.getNodeId();
        }
        DraftNode node = labels.get(target.getLabel());
        return node == null ? null : node.getId();
    }

    List<DraftNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    DraftNode getStart() {
        return start;
    }

    Map<String, DraftNode> getLabels() {
        return Collections.unmodifiableMap(labels);
    }

    Map<String, String> getFallbackNodesBySpeechNode() {
        return Collections.unmodifiableMap(fallbackNodesBySpeechNode);
    }

    /**
     * Branch joins that were still waiting for a following statement when the flow was built.
     */
    List<DanglingTail> getUnresolvedTails() {
        return Collections.unmodifiableList(unresolvedTails);
    }
}
