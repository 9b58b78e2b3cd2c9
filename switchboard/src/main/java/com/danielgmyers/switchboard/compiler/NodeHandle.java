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

import com.danielgmyers.switchboard.IdentifierValidation;
import com.danielgmyers.switchboard.ex.FlowUsageException;
import com.danielgmyers.switchboard.flow.ActionKind;

/**
 * Returned by the builder for each node it creates; used to bind labels and explicit error edges to the node.
 */
public final class NodeHandle {

    private final FlowCompilation compilation;
    private final DraftNode node;

    NodeHandle(FlowCompilation compilation, DraftNode node) {
        this.compilation = compilation;
        this.node = node;
    }

    public String getId() {
        return node.getId();
    }

    public ActionKind getKind() {
        return node.getKind();
    }

    /**
     * Binds a label to this node. Labels are unique within a flow.
     */
    public NodeHandle label(String label) {
        compilation.bindLabel(label, node);
        return this;
    }

    /**
     * Adds an error edge from this node to the node bound to the given label.
     * The label may be bound later in the program.
     */
    public NodeHandle onError(String errorType, String label) {
        compilation.requireOpen();
        if (errorType == null || errorType.isEmpty()) {
            throw new FlowUsageException("Error types must not be blank.");
        }
        IdentifierValidation.validateLabel(label);
        if (node.getErrorTypes().contains(errorType)) {
            throw new FlowUsageException(String.format("Node %s already has an error edge for %s.", node.getId(), errorType));
        }
        node.assign(node.addError(errorType), TargetRef.label(label));
        return this;
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
