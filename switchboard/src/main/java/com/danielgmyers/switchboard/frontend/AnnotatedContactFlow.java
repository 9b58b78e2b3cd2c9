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

import java.lang.reflect.InvocationTargetException;
import java.util.List;

import com.danielgmyers.switchboard.ContactFlow;
import com.danielgmyers.switchboard.annotations.ContactFlowDefinition;
import com.danielgmyers.switchboard.compiler.FlowBuilder;
import com.danielgmyers.switchboard.ex.FlowUsageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts a class annotated with @ContactFlowDefinition to the ContactFlow interface, so it compiles through
 * the same builder as a fluent definition. Each annotated method becomes one builder call, in order.
 */
public final class AnnotatedContactFlow implements ContactFlow {

    private static final Logger log = LoggerFactory.getLogger(AnnotatedContactFlow.class);

    private final Object definition;
    private final String name;
    private final List<FlowStatement> statements;

    /**
     * @param definition An instance of a class annotated with @ContactFlowDefinition.
     */
    public AnnotatedContactFlow(Object definition) {
        if (definition == null) {
            throw new FlowUsageException("Cannot compile a null flow definition.");
        }
        Class<?> clazz = definition.getClass();
        ContactFlowDefinition annotation = clazz.getAnnotation(ContactFlowDefinition.class);
        if (annotation == null) {
            String message = String.format("Class %s must have the @%s annotation.", clazz.getSimpleName(),
                                           ContactFlowDefinition.class.getSimpleName());
            log.error(message);
            throw new FlowUsageException(message);
        }

        this.definition = definition;
        this.name = annotation.name().isEmpty() ? clazz.getSimpleName() : annotation.name();
        this.statements = AnnotatedFlowUtil.collectStatements(clazz);
        if (statements.isEmpty()) {
            String message = String.format("Class %s does not declare any flow statements.", clazz.getSimpleName());
            log.error(message);
            throw new FlowUsageException(message);
        }
    }

    /**
     * Instantiates the definition class with its public no-argument constructor.
     */
    public static AnnotatedContactFlow forClass(Class<?> clazz) {
        try {
            return new AnnotatedContactFlow(clazz.getConstructor().newInstance());
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new FlowUsageException("Class " + clazz.getSimpleName()
                                         + " must have a public no-argument constructor.", e);
        } catch (InvocationTargetException e) {
            throw new FlowUsageException("The constructor of " + clazz.getSimpleName() + " threw an exception.",
                                         e.getCause());
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void define(FlowBuilder flow) {
        for (FlowStatement statement : statements) {
            log.debug("Applying {}.{} (order {})", name, statement.getMethod().getName(), statement.getOrder());
            statement.apply(definition, flow);
        }
    }
}
