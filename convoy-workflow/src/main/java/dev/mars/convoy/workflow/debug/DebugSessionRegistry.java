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

package dev.mars.convoy.workflow.debug;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the live debug sessions of one controller, keyed by session id.
 */
public class DebugSessionRegistry {

    private final Map<String, DebugSession> sessions = new ConcurrentHashMap<>();

    public DebugSession create(DebugSession session) {
        Objects.requireNonNull(session, "Session cannot be null");
        if (sessions.putIfAbsent(session.getId(), session) != null) {
            throw new IllegalArgumentException("Debug session already exists: " + session.getId());
        }
        return session;
    }

    public Optional<DebugSession> get(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<DebugSession> dispose(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.remove(sessionId));
    }

    public List<DebugSession> list() {
        List<DebugSession> result = new ArrayList<>(sessions.values());
        result.sort(Comparator.comparing(DebugSession::getCreatedAt));
        return result;
    }

    public int size() {
        return sessions.size();
    }
}
