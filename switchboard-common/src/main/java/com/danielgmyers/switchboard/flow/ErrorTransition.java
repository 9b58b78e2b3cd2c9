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

public final class ErrorTransition {

    private final String errorType;
    private final NodeRef target;

    public ErrorTransition(String errorType, NodeRef target) {
        if (errorType == null || errorType.isEmpty()) {
            throw new IllegalArgumentException("Error types must not be blank.");
        }
        if (target == null) {
            throw new IllegalArgumentException("target may not be null.");
        }
        this.errorType = errorType;
        this.target = target;
    }

    public String getErrorType() {
        return errorType;
    }

    public NodeRef getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        ErrorTransition that = (ErrorTransition) other;
        return errorType.equals(that.errorType) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorType, target);
    }
}
