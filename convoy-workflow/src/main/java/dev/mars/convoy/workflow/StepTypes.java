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

import java.util.Set;

/**
 * Step types interpreted by the engine itself rather than by a registered action.
 */
public final class StepTypes {

    public static final String CONDITION = "condition";
    public static final String LOOP_COUNT = "loop-count";
    public static final String LOOP_ARRAY = "loop-array";
    public static final String LOOP_ELEMENTS = "loop-elements";
    public static final String LOOP_WHILE = "loop-while";
    public static final String TRY_CATCH = "try-catch";
    public static final String BREAK = "break";
    public static final String CONTINUE = "continue";
    public static final String STOP = "stop";
    public static final String LOG = "log";
    public static final String COMMENT = "comment";
    public static final String CALL_WORKFLOW = "call-workflow";

    public static final Set<String> CONTROL_FLOW = Set.of(
            CONDITION, LOOP_COUNT, LOOP_ARRAY, LOOP_ELEMENTS, LOOP_WHILE, TRY_CATCH,
            BREAK, CONTINUE, STOP, LOG, COMMENT, CALL_WORKFLOW);

    private StepTypes() {
    }

    public static boolean isControlFlow(String type) {
        return type != null && CONTROL_FLOW.contains(type);
    }

    public static boolean isLoop(String type) {
        return LOOP_COUNT.equals(type) || LOOP_ARRAY.equals(type)
                || LOOP_ELEMENTS.equals(type) || LOOP_WHILE.equals(type);
    }
}
