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
 * Thrown immediately by a builder call whose arguments are wrong on their own,
 * without needing to look at the rest of the flow (an unsupported case value type, a malformed
 * attribute reference, a branch with no cases, a label bound twice, and so on).
 */
public class FlowUsageException extends FlowBuildException {

    public FlowUsageException(String message) {
        super(message);
    }

    public FlowUsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
