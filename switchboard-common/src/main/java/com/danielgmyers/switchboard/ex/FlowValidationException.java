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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by the build method when validation finds one or more fatal violations.
 * Carries every violation found, fatal or not, in the order they were found.
 */
public class FlowValidationException extends FlowBuildException {

    private final List<FlowViolation> violations;

    public FlowValidationException(List<FlowViolation> violations) {
        super(describe(violations));
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public List<FlowViolation> getViolations() {
        return violations;
    }

    public List<FlowViolation> getFatalViolations() {
        return violations.stream().filter(FlowViolation::isFatal).collect(Collectors.toList());
    }

    private static String describe(List<FlowViolation> violations) {
        long fatal = violations.stream().filter(FlowViolation::isFatal).count();
        String details = violations.stream().map(FlowViolation::toString).collect(Collectors.joining("; "));
        return String.format("Flow validation failed with %d fatal violation(s): %s", fatal, details);
    }
}
