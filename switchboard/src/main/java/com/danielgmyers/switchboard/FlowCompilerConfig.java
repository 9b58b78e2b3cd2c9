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

/**
 * Container for configuration data used by the flow compiler.
 */
public class FlowCompilerConfig {

    public static final String DEFAULT_FLOW_VERSION = "2019-10-30";

    private String flowVersion = DEFAULT_FLOW_VERSION;
    private boolean strictMode = false;

    public String getFlowVersion() {
        return flowVersion;
    }

    /**
     * The value written to the "Version" field of generated flow documents. Defaults to 2019-10-30.
     */
    public void setFlowVersion(String flowVersion) {
        if (flowVersion == null) {
            throw new IllegalArgumentException("flowVersion may not be null.");
        }
        if (flowVersion.isBlank()) {
            throw new IllegalArgumentException("flowVersion may not be blank.");
        }
        this.flowVersion = flowVersion;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    /**
     * If enabled, validation warnings (a branch without an otherwise case, a speech input without fallback
     * triggers, an unreachable node) fail the build just like structural errors do.
     *
     * Disabled by default.
     */
    public void setStrictMode(boolean strictMode) {
        this.strictMode = strictMode;
    }
}
