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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FlowCompilerConfigTest {

    @Test
    public void testDefaults() {
        FlowCompilerConfig config = new FlowCompilerConfig();
        Assertions.assertEquals(FlowCompilerConfig.DEFAULT_FLOW_VERSION, config.getFlowVersion());
        Assertions.assertFalse(config.isStrictMode());
    }

    @Test
    public void testFlowVersionMustNotBeBlank() {
        FlowCompilerConfig config = new FlowCompilerConfig();
        Assertions.assertThrows(IllegalArgumentException.class, () -> config.setFlowVersion(null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> config.setFlowVersion(""));
        Assertions.assertThrows(IllegalArgumentException.class, () -> config.setFlowVersion("   "));

        config.setFlowVersion("2020-01-01");
        Assertions.assertEquals("2020-01-01", config.getFlowVersion());
    }
}
