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


package com.danielgmyers.switchboard.ex;

/**
 * The kinds of problems the flow validator reports, along with the severity each one has outside of strict mode.
 */
public enum ViolationType {
    MISSING_START(Severity.STRUCTURAL),
    DUPLICATE_ID(Severity.STRUCTURAL),
    UNRESOLVED_REFERENCE(Severity.STRUCTURAL),
    UNRESOLVED_LABEL(Severity.STRUCTURAL),
    NODE_LIMIT_EXCEEDED(Severity.STRUCTURAL),
    UNRESOLVED_CONTINUATION(Severity.STRUCTURAL),

    MISSING_OTHERWISE(Severity.WARNING),
    UNUSED_FALLBACK(Severity.WARNING),
    UNREACHABLE_NODE(Severity.WARNING);

    private final Severity defaultSeverity;

    ViolationType(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }
}
