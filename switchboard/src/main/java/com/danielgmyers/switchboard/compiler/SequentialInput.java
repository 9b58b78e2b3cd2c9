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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import com.danielgmyers.switchboard.IdentifierValidation;
import com.danielgmyers.switchboard.ex.FlowUsageException;
import com.danielgmyers.switchboard.flow.FallbackTrigger;

/**
 * Describes one "ask the caller" step that listens for speech first and falls back to the keypad.
 * FlowBuilder.sequentialInput compiles it into a speech node and a DTMF node.
 *
 * Intent cases match on the recognized intent name; digit cases match on the keys pressed. Both take a case
 * body just like a branch case, and bodies that fall through continue with the statement after the input.
 */
public class SequentialInput {

    private final String promptText;
    private final SpeechConfig speechConfig;
    private final DtmfConfig dtmfConfig;
    private final Set<FallbackTrigger> fallbackTriggers;

    private final List<BranchCase> intentCases = new ArrayList<>();
    private final List<BranchCase> digitCases = new ArrayList<>();
    private Consumer<FlowBuilder> otherwise;
    private String dtmfLabel;

    public SequentialInput(String promptText, SpeechConfig speechConfig, DtmfConfig dtmfConfig,
                           Set<FallbackTrigger> fallbackTriggers) {
        if (promptText == null || promptText.isEmpty()) {
            throw new FlowUsageException("Sequential inputs need a prompt.");
        }
        if (speechConfig == null || dtmfConfig == null) {
            throw new FlowUsageException("Sequential inputs need both a speech and a DTMF configuration.");
        }
        if (fallbackTriggers == null) {
            throw new FlowUsageException("fallbackTriggers may be empty but not null.");
        }
        this.promptText = promptText;
        this.speechConfig = speechConfig;
        this.dtmfConfig = dtmfConfig;
        this.fallbackTriggers = fallbackTriggers.isEmpty() ? EnumSet.noneOf(FallbackTrigger.class)
                                                           : EnumSet.copyOf(fallbackTriggers);
    }

    public SequentialInput intent(String intentName, Consumer<FlowBuilder> body) {
        intentCases.add(BranchCase.when(intentName, body));
        return this;
    }

    public SequentialInput intentJump(String intentName, String label) {
        intentCases.add(BranchCase.jump(intentName, label));
        return this;
    }

    public SequentialInput digits(String digits, Consumer<FlowBuilder> body) {
        digitCases.add(BranchCase.when(digits, body));
        return this;
    }

    public SequentialInput digitsJump(String digits, String label) {
        digitCases.add(BranchCase.jump(digits, label));
        return this;
    }

    /**
     * Runs when the keypad input matches no digit case, times out, or fails.
     */
    public SequentialInput otherwise(Consumer<FlowBuilder> body) {
        if (body == null) {
            throw new FlowUsageException("otherwise body may not be null.");
        }
        this.otherwise = body;
        return this;
    }

    /**
     * Binds a label to the DTMF node, so it can be jumped to directly.
     */
    public SequentialInput dtmfLabel(String label) {
        IdentifierValidation.validateLabel(label);
        this.dtmfLabel = label;
        return this;
    }

    public String getPromptText() {
        return promptText;
    }

    public SpeechConfig getSpeechConfig() {
        return speechConfig;
    }

    public DtmfConfig getDtmfConfig() {
        return dtmfConfig;
    }

    /**
     * Iterates in declaration order of FallbackTrigger, which fixes the order of the generated error edges.
     */
    public Set<FallbackTrigger> getFallbackTriggers() {
        return Collections.unmodifiableSet(fallbackTriggers);
    }

    List<BranchCase> getIntentCases() {
        return Collections.unmodifiableList(intentCases);
    }

    List<BranchCase> getDigitCases() {
        return Collections.unmodifiableList(digitCases);
    }

    Consumer<FlowBuilder> getOtherwise() {
        return otherwise;
    }

    String getDtmfLabel() {
        return dtmfLabel;
    }
}
