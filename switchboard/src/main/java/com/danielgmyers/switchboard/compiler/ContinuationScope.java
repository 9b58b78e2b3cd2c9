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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * One frame of the continuation-scope stack: the dangling tails of a single builder level.
 * Whatever that builder creates next receives every tail held here.
 */
final class ContinuationScope {

    private final String name;
    private final List<DanglingTail> tails = new ArrayList<>();

    ContinuationScope(String name) {
        this.name = name;
    }

    String getName() {
        return name;
    }

    void add(DanglingTail tail) {
        tails.add(tail);
    }

    void addAll(Collection<DanglingTail> moreTails) {
        tails.addAll(moreTails);
    }

    boolean isEmpty() {
        return tails.isEmpty();
    }

    List<DanglingTail> getTails() {
        return Collections.unmodifiableList(tails);
    }

    /**
     * Removes and returns every tail in the frame.
     */
    List<DanglingTail> drain() {
        List<DanglingTail> drained = new ArrayList<>(tails);
        tails.clear();
        return drained;
    }

    @Override
    public String toString() {
        return name + tails;
    }
}
