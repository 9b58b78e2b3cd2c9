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
 * Settings for the speech (intent recognition) half of a sequential input.
 *
 * The bot alias reference is passed through to the runtime as-is; the compiler does not check that it exists.
 */
public class SpeechConfig {

    private final String botAliasRef;
    private String localeId;
    private Double confidenceThreshold;

    public SpeechConfig(String botAliasRef) {
        if (botAliasRef == null || botAliasRef.isEmpty()) {
            throw new IllegalArgumentException("botAliasRef may not be blank.");
        }
        this.botAliasRef = botAliasRef;
    }

    public String getBotAliasRef() {
        return botAliasRef;
    }

    public String getLocaleId() {
        return localeId;
    }

    /**
     * Overrides the bot's locale, e.g. "en_US". Optional.
     */
    public SpeechConfig setLocaleId(String localeId) {
        if (localeId == null || localeId.isEmpty()) {
            throw new IllegalArgumentException("localeId may not be blank.");
        }
        this.localeId = localeId;
        return this;
    }

    public Double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    /**
     * Intent matches below this confidence count as low-confidence. Must be between 0 and 1.
     */
    public SpeechConfig setConfidenceThreshold(Double confidenceThreshold) {
        if (confidenceThreshold == null) {
            throw new IllegalArgumentException("confidenceThreshold may not be null.");
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be between 0 and 1.");
        }
        this.confidenceThreshold = confidenceThreshold;
        return this;
    }

    Map<String, String> toParameters(String promptText) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("Text", promptText);
        parameters.put("BotAliasArn", botAliasRef);
        if (localeId != null) {
            parameters.put("LocaleId", localeId);
        }
        if (confidenceThreshold != null) {
            parameters.put("ConfidenceThreshold", FlowValues.toRuntimeString(confidenceThreshold));
        }
        return parameters;
    }
}
