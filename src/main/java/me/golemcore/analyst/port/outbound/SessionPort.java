package me.golemcore.analyst.port.outbound;

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

import me.golemcore.analyst.domain.model.AgentSession;
import me.golemcore.analyst.domain.model.ApprovalMode;
import me.golemcore.analyst.domain.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Port for session memory. Abstracts session storage and message compaction
 * from orchestration so that the in-memory store can be replaced by a durable
 * one.
 *
 * <p>
 * Sessions returned by {@link #get(String)} are the live instances; callers
 * mutate them only while holding the session lock.
 */
public interface SessionPort {

    AgentSession create(ApprovalMode approvalMode);

    Optional<AgentSession> get(String sessionId);

    /**
     * Appends a message to the session's log and returns it with its assigned
     * index.
     *
     * @throws me.golemcore.analyst.domain.model.AgentException
     *             NOT_FOUND for unknown ids
     */
    Message appendMessage(String sessionId, Message message);

    void save(AgentSession session);

    boolean delete(String sessionId);

    int compactWithSummary(String sessionId, int keepLast, Message summaryMessage);

    List<Message> getMessagesToCompact(String sessionId, int keepLast);

    int getMessageCount(String sessionId);
}
