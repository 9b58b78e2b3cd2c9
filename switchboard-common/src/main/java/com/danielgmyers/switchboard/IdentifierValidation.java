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


package com.danielgmyers.switchboard;

import java.util.regex.Pattern;

import com.danielgmyers.switchboard.ex.FlowUsageException;

/**
 * The flow runtime accepts action identifiers up to 100 characters long. Generated identifiers are
 * always well within that, but callers may also supply their own node ids, and labels end up in log output
 * and error messages, so both are checked here when they are first used.
 *
 * In summary, we will enforce these length limits:
 * * Node ids: 100
 * * Labels: 100
 *
 * Both reject whitespace and control characters (U+0000-001F, U+007F-009F).
 */
public final class IdentifierValidation {

    public static final int MAX_NODE_ID_LENGTH = 100;
    public static final int MAX_LABEL_LENGTH = 100;

    private static final Pattern INVALID_CHARACTERS = Pattern.compile("[\u0000- \u007F-\u009F]+");

    private IdentifierValidation() {}

    public static void validateNodeId(String nodeId) {
        validate("Node ids", nodeId, MAX_NODE_ID_LENGTH);
    }

    public static void validateLabel(String label) {
        validate("Labels", label, MAX_LABEL_LENGTH);
    }

    // Package-private for testing.
    static void validate(String description, String inputToValidate, int max) {
        if (inputToValidate == null || inputToValidate.isEmpty()) {
            throw new FlowUsageException(description + " must contain at least one character.");
        }
        if (inputToValidate.length() > max) {
            throw new FlowUsageException(description + " must not be longer than " + max + " characters.");
        }
        if (INVALID_CHARACTERS.matcher(inputToValidate).find()) {
            throw new FlowUsageException(description + " must not contain whitespace"
                    + " or any control characters (\\u0000-\\u001f | \\u007f-\\u009f).");
        }
    }
}
