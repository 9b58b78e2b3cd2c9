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


package com.danielgmyers.switchboard.frontend;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.switchboard.annotations.FlowAction;
import com.danielgmyers.switchboard.annotations.FlowBranch;
import com.danielgmyers.switchboard.annotations.FlowCase;
import com.danielgmyers.switchboard.annotations.FlowJump;
import com.danielgmyers.switchboard.annotations.Param;
import com.danielgmyers.switchboard.compiler.BranchCase;
import com.danielgmyers.switchboard.compiler.FlowBuilder;
import com.danielgmyers.switchboard.ex.FlowBuildException;
import com.danielgmyers.switchboard.ex.FlowUsageException;

/**
 * One annotated method of a flow definition, lowered to a single builder call.
 */
final class FlowStatement {

    private final Method method;
    private final Annotation annotation;

    FlowStatement(Method method, Annotation annotation) {
        this.method = method;
        this.annotation = annotation;
    }

    int getOrder() {
        if (annotation instanceof FlowAction) {
            return ((FlowAction) annotation).order();
        } else if (annotation instanceof FlowBranch) {
            return ((FlowBranch) annotation).order();
        }
        return ((FlowJump) annotation).order();
    }

    boolean isAction() {
        return annotation instanceof FlowAction;
    }

    Method getMethod() {
        return method;
    }

    void apply(Object definition, FlowBuilder flow) {
        if (annotation instanceof FlowAction) {
            applyAction(definition, flow, (FlowAction) annotation);
        } else if (annotation instanceof FlowBranch) {
            applyBranch(flow, (FlowBranch) annotation);
        } else {
            flow.jumpTo(((FlowJump) annotation).target());
        }
    }

    private void applyAction(Object definition, FlowBuilder flow, FlowAction action) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (Param param : method.getAnnotationsByType(Param.class)) {
            parameters.put(param.name(), param.value());
        }

        Object result = invoke(definition);
        if (result != null) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) result).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new FlowUsageException(String.format("%s returned a parameter map with a non-String key: %s",
                                                               describe(), entry.getKey()));
                }
                parameters.put((String) entry.getKey(), entry.getValue());
            }
        }

        String label = action.label().isEmpty() ? null : action.label();
        if (action.id().isEmpty()) {
            flow.append(action.kind(), parameters, label);
        } else {
            flow.appendWithId(action.id(), action.kind(), parameters, label);
        }
    }

    private void applyBranch(FlowBuilder flow, FlowBranch branch) {
        List<BranchCase> cases = new ArrayList<>();
        for (FlowCase flowCase : branch.cases()) {
            cases.add(BranchCase.jump(branch.operator(), flowCase.value(), flowCase.target()));
        }
        String otherwise = branch.otherwise();
        if (otherwise.isEmpty()) {
            flow.branch(branch.attribute(), cases, f -> { });
        } else {
            flow.branch(branch.attribute(), cases, f -> f.jumpTo(otherwise));
        }
    }

    private Object invoke(Object definition) {
        try {
            return method.invoke(definition);
        } catch (InvocationTargetException e) {
            throw new FlowBuildException(describe() + " threw an exception.", e.getCause());
        } catch (IllegalAccessException e) {
            // Only public methods are collected, so this shouldn't happen.
            throw new FlowBuildException("Unable to call " + describe() + ".", e);
        }
    }

    private String describe() {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }
}
