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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a compiled contact flow. Immutable; nodes are only created by the flow builder.
 */
public final class ActionNode {

    private final String id;
    private final ActionKind kind;
    private final Map<String, String> parameters;
    private final Transitions transitions;

    public ActionNode(String id, ActionKind kind, Map<String, String> parameters, Transitions transitions) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Action nodes must have an id.");
        }
        if (kind == null || parameters == null || transitions == null) {
            throw new IllegalArgumentException("kind, parameters and transitions are required.");
        }
        this.id = id;
        this.kind = kind;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.transitions = transitions;
    }

    public String getId() {
        return id;
    }

    public ActionKind getKind() {
        return kind;
    }

    /**
     * Parameters in the order they were supplied.
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

    public Transitions getTransitions() {
        return transitions;
    }

    @Override
    public String toString() {
        return kind + "(" + id + ")";
    }
}
