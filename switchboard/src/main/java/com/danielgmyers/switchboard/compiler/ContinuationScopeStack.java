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

import java.util.ArrayDeque;
import java.util.Deque;

import com.danielgmyers.switchboard.ex.FlowUsageException;

/**
 * Tracks which builder level is currently open. The root builder's frame sits at the bottom; each case body
 * of a branch pushes a frame while it runs and pops it when it returns.
 */
final class ContinuationScopeStack {

    private final Deque<ContinuationScope> frames = new ArrayDeque<>();

    void push(ContinuationScope scope) {
        frames.push(scope);
    }

    /**
     * Pops the given frame, which must be the innermost one.
     */
    ContinuationScope pop(ContinuationScope expected) {
        if (frames.peek() != expected) {
            throw new IllegalStateException("Scope " + expected.getName() + " is not the innermost open scope.");
        }
        return frames.pop();
    }

    boolean isInnermost(ContinuationScope scope) {
        return frames.peek() == scope;
    }

    /**
     * Fails unless the given frame is the innermost one, which is the case exactly when the builder owning it is
     * the one the program is supposed to be talking to.
     */
    void requireInnermost(ContinuationScope scope) {
        if (!isInnermost(scope)) {
            throw new FlowUsageException("A builder was used from inside a nested case body (scope " + scope.getName()
                                         + " is not the innermost open scope). Use the builder passed to the case body.");
        }
    }

    int depth() {
        return frames.size();
    }

    boolean isEmpty() {
        return frames.isEmpty();
    }
}
