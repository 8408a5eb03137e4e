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

import dev.mars.convoy.core.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local workflow registry. Definitions are validated on registration.
 */
public class InMemoryWorkflowRegistry implements WorkflowRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWorkflowRegistry.class);

    private final WorkflowValidator validator;
    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();

    public InMemoryWorkflowRegistry(WorkflowValidator validator) {
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
    }

    @Override
    public Optional<Workflow> get(String workflowId) {
        return workflowId == null ? Optional.empty() : Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public void register(Workflow workflow) throws WorkflowParseException {
        ValidationResult validation = validator.validate(workflow);
        if (!validation.isValid()) {
            throw new WorkflowParseException(workflow != null ? workflow.getName() : null, validation);
        }
        validation.getWarnings().forEach(warning ->
                logger.warn("Workflow {}: {}", workflow.getId(), warning));
        workflows.put(workflow.getId(), workflow);
        logger.info("Registered workflow {} ({})", workflow.getId(), workflow.getName());
    }

    @Override
    public List<Workflow> list() {
        List<Workflow> result = new ArrayList<>(workflows.values());
        result.sort(Comparator.comparing(Workflow::getId));
        return result;
    }

    @Override
    public boolean delete(String workflowId) {
        boolean removed = workflowId != null && workflows.remove(workflowId) != null;
        if (removed) {
            logger.info("Deleted workflow {}", workflowId);
        }
        return removed;
    }
}
