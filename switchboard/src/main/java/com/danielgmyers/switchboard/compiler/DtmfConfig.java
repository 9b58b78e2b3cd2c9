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

import java.util.LinkedHashMap;
import java.util.Map;

import com.danielgmyers.switchboard.values.FlowValues;

/**
 * Settings for the keypad (DTMF) half of a sequential input.
 */
public class DtmfConfig {

    private String promptText;
    private long inputTimeLimitSeconds = 5;
    private long maxDigits = 1;

    public String getPromptText() {
        return promptText;
    }

    /**
     * The prompt played before collecting digits. If not set, the sequential input's prompt is played again.
     */
    public DtmfConfig setPromptText(String promptText) {
        if (promptText == null || promptText.isEmpty()) {
            throw new IllegalArgumentException("promptText may not be blank.");
        }
        this.promptText = promptText;
        return this;
    }

    public long getInputTimeLimitSeconds() {
        return inputTimeLimitSeconds;
    }

    /**
     * How long to wait for the caller to press a key. Defaults to 5 seconds.
     */
    public DtmfConfig setInputTimeLimitSeconds(long inputTimeLimitSeconds) {
        if (inputTimeLimitSeconds < 1) {
            throw new IllegalArgumentException("inputTimeLimitSeconds must be at least 1.");
        }
        this.inputTimeLimitSeconds = inputTimeLimitSeconds;
        return this;
    }

    public long getMaxDigits() {
        return maxDigits;
    }

    /**
     * Defaults to 1.
     */
    public DtmfConfig setMaxDigits(long maxDigits) {
        if (maxDigits < 1) {
            throw new IllegalArgumentException("maxDigits must be at least 1.");
        }
        this.maxDigits = maxDigits;
        return this;
    }

    Map<String, String> toParameters(String fallbackPromptText) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("Text", promptText != null ? promptText : fallbackPromptText);
        parameters.put("StoreInput", FlowValues.toRuntimeString(false));
        parameters.put("InputTimeLimitSeconds", FlowValues.toRuntimeString(inputTimeLimitSeconds));
        parameters.put("MaxDigits", FlowValues.toRuntimeString(maxDigits));
        return parameters;
    }
}
