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

import com.danielgmyers.switchboard.compiler.FlowBuilder;

/**
 * A contact flow defined with the fluent builder. Implementations describe the flow's statements in define().
 */
public interface ContactFlow {

    /**
     * A name for the flow, used in log output.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    void define(FlowBuilder flow);
}
