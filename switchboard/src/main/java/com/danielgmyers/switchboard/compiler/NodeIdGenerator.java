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

import java.util.Locale;

import com.danielgmyers.switchboard.flow.ActionKind;

/**
 * Produces node ids from a counter that advances once per created node, so the same program always
 * yields the same ids.
 */
final class NodeIdGenerator {

    private int counter = 0;

    /**
     * Advances the counter and returns the generated id for a node of the given kind.
     */
    String next(ActionKind kind) {
        counter++;
        return String.format(Locale.ROOT, "%s-%04d", kind.getIdStem(), counter);
    }

    /**
     * Advances the counter for a node whose id the caller supplied.
     */
    void skip() {
        counter++;
    }

    int getCounter() {
        return counter;
    }
}
