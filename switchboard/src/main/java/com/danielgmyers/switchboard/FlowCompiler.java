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


package com.danielgmyers.switchboard;

import com.danielgmyers.switchboard.compiler.FlowBuilder;
import com.danielgmyers.switchboard.ex.FlowValidationException;
import com.danielgmyers.switchboard.flow.FlowGraph;
import com.danielgmyers.switchboard.frontend.AnnotatedContactFlow;
import com.danielgmyers.switchboard.serialization.FlowSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The primary class through which flows are compiled. Holds no per-flow state, so one instance can compile
 * any number of flows, from any number of threads.
 */
public class FlowCompiler {

    private static final Logger log = LoggerFactory.getLogger(FlowCompiler.class);

    private final FlowCompilerConfig config;
    private final FlowSerializer serializer;

    public FlowCompiler() {
        this(new FlowCompilerConfig());
    }

    public FlowCompiler(FlowCompilerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config may not be null.");
        }
        this.config = config;
        this.serializer = new FlowSerializer(config.getFlowVersion());
    }

    /**
     * Runs the flow's definition against a fresh builder and returns the validated graph.
     * @throws FlowValidationException if the flow fails validation.
     */
    public FlowGraph compile(ContactFlow flow) {
        if (flow == null) {
            throw new IllegalArgumentException("flow may not be null.");
        }
        FlowBuilder builder = new FlowBuilder(config);
        flow.define(builder);

        FlowGraph graph;
        try {
            graph = builder.build();
        } catch (FlowValidationException e) {
            log.error("Flow {} failed validation with {} fatal violation(s).", flow.name(), e.getFatalViolations().size());
            throw e;
        }
        log.info("Compiled flow {}: {} actions, {} warning(s).", flow.name(), graph.size(), graph.getWarnings().size());
        return graph;
    }

    /**
     * Compiles an instance of a class annotated with @ContactFlowDefinition.
     */
    public FlowGraph compileAnnotated(Object definition) {
        return compile(new AnnotatedContactFlow(definition));
    }

    /**
     * Compiles a class annotated with @ContactFlowDefinition, using its public no-argument constructor.
     */
    public FlowGraph compileAnnotated(Class<?> definitionClass) {
        return compile(AnnotatedContactFlow.forClass(definitionClass));
    }

    public String toJson(FlowGraph graph) {
        return serializer.serialize(graph);
    }

    public String compileToJson(ContactFlow flow) {
        return toJson(compile(flow));
    }
}
