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

import java.util.List;
import java.util.Optional;

/**
 * Workflows keyed by id, used by {@code call-workflow} steps and by the scheduler.
 */
public interface WorkflowRegistry {

    Optional<Workflow> get(String workflowId);

    /**
     * Registers or replaces a workflow.
     *
     * @throws WorkflowParseException if the definition is invalid
     */
    void register(Workflow workflow) throws WorkflowParseException;

    List<Workflow> list();

    /**
     * @return true if a workflow was removed
     */
    boolean delete(String workflowId);
}
