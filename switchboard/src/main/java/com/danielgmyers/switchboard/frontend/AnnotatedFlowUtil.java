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
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.danielgmyers.switchboard.annotations.FlowAction;
import com.danielgmyers.switchboard.annotations.FlowBranch;
import com.danielgmyers.switchboard.annotations.FlowJump;
import com.danielgmyers.switchboard.ex.FlowUsageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for extracting the statements of an annotated flow definition.
 */
final class AnnotatedFlowUtil {

    private static final Logger log = LoggerFactory.getLogger(AnnotatedFlowUtil.class);

    private AnnotatedFlowUtil() {}

    /**
     * Given a type, finds all public methods that have the specified annotation and maps those methods to the annotation.
     * Methods are sorted by name, since getMethods() does not promise any order.
     */
    static <T extends Annotation> Map<Method, T> getAllMethodsWithAnnotation(Class<?> clazz, Class<T> annotationType) {
        Map<Method, T> matching = new LinkedHashMap<>();
        List<Method> methods = new ArrayList<>(List.of(clazz.getMethods()));
        methods.sort(Comparator.comparing(Method::getName));
        for (Method method : methods) {
            if (method.isAnnotationPresent(annotationType)) {
                matching.put(method, method.getAnnotation(annotationType));
            }
        }
        if (matching.isEmpty()) {
            log.debug("No @{} methods found in {}.", annotationType.getSimpleName(), clazz.getSimpleName());
        } else {
            String names = matching.keySet().stream().map(Method::getName).collect(Collectors.joining(", "));
            log.debug("Found {} @{} methods in {}: {}", matching.size(), annotationType.getSimpleName(),
                      clazz.getSimpleName(), names);
        }
        return matching;
    }

    /**
     * Collects every @FlowAction, @FlowBranch and @FlowJump method of the class, sorted by order.
     * Throws if a method carries more than one of them, if two share an order, or if a method's signature
     * doesn't fit its annotation.
     */
    static List<FlowStatement> collectStatements(Class<?> clazz) {
        Map<Method, Annotation> statementsByMethod = new LinkedHashMap<>();
        collect(clazz, FlowAction.class, statementsByMethod);
        collect(clazz, FlowBranch.class, statementsByMethod);
        collect(clazz, FlowJump.class, statementsByMethod);

        Map<Integer, Method> methodsByOrder = new HashMap<>();
        List<FlowStatement> statements = new ArrayList<>();
        for (Map.Entry<Method, Annotation> entry : statementsByMethod.entrySet()) {
            Method method = entry.getKey();
            FlowStatement statement = new FlowStatement(method, entry.getValue());

            if (methodsByOrder.containsKey(statement.getOrder())) {
                fail(String.format("%s.%s and %s.%s both use order %d.", clazz.getSimpleName(),
                                   methodsByOrder.get(statement.getOrder()).getName(), clazz.getSimpleName(),
                                   method.getName(), statement.getOrder()));
            }
            methodsByOrder.put(statement.getOrder(), method);

            if (method.getParameterCount() != 0) {
                fail(String.format("%s.%s must not take any parameters.", clazz.getSimpleName(), method.getName()));
            }
            boolean returnsParameters = Map.class.isAssignableFrom(method.getReturnType());
            boolean returnsVoid = void.class.equals(method.getReturnType());
            if (!returnsVoid && !(returnsParameters && statement.isAction())) {
                fail(String.format("%s.%s must return %s.", clazz.getSimpleName(), method.getName(),
                                   statement.isAction() ? "void or a Map of parameters" : "void"));
            }
            statements.add(statement);
        }

        statements.sort(Comparator.comparingInt(FlowStatement::getOrder));
        return statements;
    }

    private static void collect(Class<?> clazz, Class<? extends Annotation> annotationType,
                                Map<Method, Annotation> statementsByMethod) {
        for (Map.Entry<Method, ? extends Annotation> entry : getAllMethodsWithAnnotation(clazz, annotationType).entrySet()) {
            Annotation previous = statementsByMethod.put(entry.getKey(), entry.getValue());
            if (previous != null) {
                fail(String.format("%s.%s must not have both @%s and @%s.", clazz.getSimpleName(),
                                   entry.getKey().getName(), previous.annotationType().getSimpleName(),
                                   annotationType.getSimpleName()));
            }
        }
    }

    private static void fail(String message) {
        log.error(message);
        throw new FlowUsageException(message);
    }
}
