/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.convoy.workflow;

import dev.mars.convoy.config.ConvoyConfiguration;
import dev.mars.convoy.core.Execution;
import dev.mars.convoy.core.Ids;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.core.exceptions.WorkflowNotFoundException;
import dev.mars.convoy.workflow.action.ActionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point tying the workflow registry, the definition parser and the engine together.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class WorkflowManager {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowManager.class);

    private final WorkflowRegistry registry;
    private final WorkflowDefinitionParser parser;
    private final WorkflowEngine engine;

    public WorkflowManager(WorkflowRegistry registry, WorkflowDefinitionParser parser, WorkflowEngine engine) {
        this.registry = Objects.requireNonNull(registry, "Workflow registry cannot be null");
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
    }

    /**
     * Wires an in-memory registry and a {@link SimpleWorkflowEngine} over the given actions.
     */
    public static WorkflowManager create(ActionRegistry actionRegistry, ConvoyConfiguration configuration) {
        WorkflowValidator validator = new WorkflowValidator(actionRegistry);
        WorkflowRegistry registry = new InMemoryWorkflowRegistry(validator);
        WorkflowEngine engine = new SimpleWorkflowEngine(actionRegistry, registry, configuration);
        return new WorkflowManager(registry, new YamlWorkflowDefinitionParser(validator), engine);
    }

    public Workflow registerWorkflow(Workflow workflow) throws WorkflowParseException {
        registry.register(workflow);
        return workflow;
    }

    /**
     * Parses and registers a YAML or JSON definition.
     */
    public Workflow registerFromString(String content) throws WorkflowParseException {
        return registerWorkflow(parser.parseFromString(content));
    }

    public Workflow registerFromFile(Path file) throws WorkflowParseException {
        return registerWorkflow(parser.parse(file));
    }

    public Optional<Workflow> getWorkflow(String workflowId) {
        return registry.get(workflowId);
    }

    public List<Workflow> listWorkflows() {
        return registry.list();
    }

    public boolean deleteWorkflow(String workflowId) {
        return registry.delete(workflowId);
    }

    /**
     * Runs a registered workflow on the calling thread.
     *
     * @throws WorkflowNotFoundException if no workflow is registered under the id
     */
    public Execution executeWorkflow(String workflowId, RunOptions options) throws WorkflowNotFoundException {
        Workflow workflow = require(workflowId);
        return engine.execute(workflow, withExecutionId(options));
    }

    public CompletableFuture<Execution> executeWorkflowAsync(String workflowId, RunOptions options)
            throws WorkflowNotFoundException {
        Workflow workflow = require(workflowId);
        return engine.executeAsync(workflow, withExecutionId(options));
    }

    public boolean stopExecution(String executionId) {
        boolean cancelled = engine.cancel(executionId);
        if (!cancelled) {
            logger.debug("No running execution {} to stop", executionId);
        }
        return cancelled;
    }

    public List<Execution> listRunningExecutions() {
        return engine.getActiveExecutions();
    }

    public WorkflowRegistry getRegistry() {
        return registry;
    }

    public WorkflowEngine getEngine() {
        return engine;
    }

    public void shutdown() {
        engine.shutdown();
    }

    private Workflow require(String workflowId) throws WorkflowNotFoundException {
        return registry.get(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private static RunOptions withExecutionId(RunOptions options) {
        RunOptions base = options != null ? options : RunOptions.defaults();
        return base.getExecutionId() != null ? base : base.toBuilder().executionId(Ids.next("exec")).build();
    }
}
