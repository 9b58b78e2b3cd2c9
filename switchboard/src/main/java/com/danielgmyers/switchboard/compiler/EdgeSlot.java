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
 * Identifies one outgoing edge of a draft node: its next edge, or one of its condition or error edges by index.
 */
final class EdgeSlot {

    enum Type { NEXT, CONDITION, ERROR }

    private static final EdgeSlot NEXT = new EdgeSlot(Type.NEXT, -1);

    private final Type type;
    private final int index;

    private EdgeSlot(Type type, int index) {
        this.type = type;
        this.index = index;
    }

    static EdgeSlot next() {
        return NEXT;
    }

    static EdgeSlot condition(int index) {
        return new EdgeSlot(Type.CONDITION, index);
    }

    static EdgeSlot error(int index) {
        return new EdgeSlot(Type.ERROR, index);
    }

    Type getType() {
        return type;
    }

    int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        EdgeSlot that = (EdgeSlot) other;
        return type == that.type && index == that.index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, index);
    }

    @Override
    public String toString() {
        return type == Type.NEXT ? "next" : type.name().toLowerCase() + "[" + index + "]";
    }
}
