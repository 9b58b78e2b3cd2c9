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
 * Error type names understood by the flow runtime.
 */
public final class ErrorTypes {

    public static final String NO_MATCHING_CONDITION = "NoMatchingCondition";
    public static final String NO_MATCHING_ERROR = "NoMatchingError";
    public static final String INPUT_TIME_LIMIT_EXCEEDED = "InputTimeLimitExceeded";
    public static final String CONFIDENCE_THRESHOLD_NOT_MET = "ConfidenceThresholdNotMet";
    public static final String INVALID_INPUT = "InvalidInput";
    public static final String MAX_RETRIES_EXCEEDED = "MaxRetriesExceeded";

    private ErrorTypes() {}
}
