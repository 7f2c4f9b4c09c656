package me.golemcore.analyst.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Contract violation reported synchronously to the caller of an agent
 * operation. The {@link AgentErrorKind} is stable and safe to branch on; the
 * message is for humans.
 */
public class AgentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AgentErrorKind kind;

    public AgentException(AgentErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentErrorKind getKind() {
        return kind;
    }

    public static AgentException notFound(String sessionId) {
        return new AgentException(AgentErrorKind.NOT_FOUND, "Session not found: " + sessionId);
    }
}
