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


package com.danielgmyers.switchboard.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.danielgmyers.switchboard.flow.ComparisonOperator;

/**
 * Declares a branch on a contact attribute. Every case jumps to a label.
 *
 * If otherwise() is blank, contacts that match no case continue with the next statement of the definition.
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface FlowBranch {

    int order();

    /**
     * The attribute to compare, e.g. "$.Attributes.Tier".
     */
    String attribute();

    ComparisonOperator operator() default ComparisonOperator.EQUALS;

    FlowCase[] cases();

    /**
     * Label to go to when no case matches.
     */
    String otherwise() default "";
}
