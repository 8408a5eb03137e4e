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

package dev.mars.convoy.scheduler.profile;

import dev.mars.convoy.workflow.action.BrowserPage;

import java.util.Map;

/**
 * An open browser context for one profile. Closing it releases the context and its page.
 */
public interface ProfileSession extends AutoCloseable {

    /**
     * Page handle for the run, or null when the session has no page.
     */
    BrowserPage page();

    /**
     * Values exposed to the run as {@code session.*}.
     */
    Map<String, Object> session();

    @Override
    void close() throws Exception;
}
