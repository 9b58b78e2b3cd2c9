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
 * Situations in which a speech input node hands the caller over to its keypad (DTMF) fallback.
 * Each enabled trigger becomes one error transition carrying the trigger's error type.
 */
public enum FallbackTrigger {
    TIMEOUT(ErrorTypes.INPUT_TIME_LIMIT_EXCEEDED),
    NO_MATCH(ErrorTypes.NO_MATCHING_CONDITION),
    LOW_CONFIDENCE(ErrorTypes.CONFIDENCE_THRESHOLD_NOT_MET),
    INVALID_INPUT(ErrorTypes.INVALID_INPUT),
    ERROR(ErrorTypes.NO_MATCHING_ERROR),
    MAX_RETRIES_EXCEEDED(ErrorTypes.MAX_RETRIES_EXCEEDED);

    private final String errorType;

    FallbackTrigger(String errorType) {
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType;
    }
}
