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

package dev.mars.convoy.workflow.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps step types to their {@link Action} implementations.
 * Control-flow step types are interpreted by the engine and never registered here.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ActionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, Action> actions = new ConcurrentHashMap<>();

    /**
     * A registry holding the built-in utility actions.
     */
    public static ActionRegistry withBuiltIns() {
        ActionRegistry registry = new ActionRegistry();
        registry.register(SetVariableAction.TYPE, new SetVariableAction());
        registry.register(WaitTimeAction.TYPE, new WaitTimeAction());
        registry.register(ArrayPushAction.TYPE, new ArrayPushAction());
        registry.register(RandomNumberAction.TYPE, new RandomNumberAction());
        return registry;
    }

    public void register(String type, Action action) {
        Objects.requireNonNull(type, "Action type cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        if (actions.put(type, action) != null) {
            logger.debug("Replaced action for type '{}'", type);
        }
    }

    public boolean hasAction(String type) {
        return type != null && actions.containsKey(type);
    }

    public Optional<Action> getAction(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(actions.get(type));
    }

    public Set<String> getActionTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(actions.keySet()));
    }
}
