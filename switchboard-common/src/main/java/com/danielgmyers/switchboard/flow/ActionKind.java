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


package com.danielgmyers.switchboard.flow;

/**
 * The kinds of action a flow node can perform, along with the type name the flow runtime knows them by.
 *
 * Terminal kinds end the caller's path through the flow, so the builder never links a following statement to them.
 */
public enum ActionKind {
    PROMPT("MessageParticipant", "prompt", false),
    INPUT("GetParticipantInput", "input", false),
    SPEECH_INPUT("ConnectParticipantWithLexBot", "speech", false),
    BRANCH("Compare", "branch", false),
    INVOKE("InvokeLambdaFunction", "invoke", false),
    SET_ATTRIBUTES("UpdateContactAttributes", "attributes", false),
    SET_QUEUE("UpdateContactTargetQueue", "queue", false),
    SET_LOGGING("UpdateFlowLoggingBehavior", "logging", false),
    CHECK_HOURS("CheckHoursOfOperation", "hours", false),
    TRANSFER("TransferContactToQueue", "transfer", true),
    DISCONNECT("DisconnectParticipant", "disconnect", true);

    private final String runtimeType;
    private final String idStem;
    private final boolean terminal;

    ActionKind(String runtimeType, String idStem, boolean terminal) {
        this.runtimeType = runtimeType;
        this.idStem = idStem;
        this.terminal = terminal;
    }

    /**
     * The value written to the "Type" field of the flow document.
     */
    public String getRuntimeType() {
        return runtimeType;
    }

    /**
     * Prefix used when generating node ids for this kind.
     */
    public String getIdStem() {
        return idStem;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
