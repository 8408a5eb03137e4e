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

/**
 * The browser tab a run drives. Supplied by the session provider; the engine only uses it
 * for element, text and url conditions and element loops, and passes it through to actions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public interface BrowserPage extends AutoCloseable {

    /**
     * Number of elements matching a CSS selector.
     */
    int count(String selector) throws Exception;

    boolean isVisible(String selector) throws Exception;

    /**
     * Text content of the first element matching the selector, or {@code null} when none matches.
     */
    String textContent(String selector) throws Exception;

    String url() throws Exception;

    /**
     * Evaluate a script in the page and return its result.
     */
    Object evaluate(String script) throws Exception;

    @Override
    void close() throws Exception;
}
