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

import com.danielgmyers.switchboard.flow.ActionKind;

/**
 * Declares that the annotated method appends one action node.
 *
 * Static parameters may be listed with @Param. If the method returns a Map, its entries are added after
 * the static parameters; otherwise the method must return void. The method must not take any arguments.
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface FlowAction {

    /**
     * Position of this statement in the flow. Must be unique within the definition class.
     */
    int order();

    ActionKind kind();

    /**
     * If not blank, binds this label to the node so branches and jumps can refer to it.
     */
    String label() default "";

    /**
     * If not blank, used as the node's id instead of a generated one.
     */
    String id() default "";
}
