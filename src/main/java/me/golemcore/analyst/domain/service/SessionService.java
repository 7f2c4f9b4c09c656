package me.golemcore.analyst.domain.service;

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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.domain.model.AgentException;
import me.golemcore.analyst.domain.model.AgentSession;
import me.golemcore.analyst.domain.model.ApprovalMode;
import me.golemcore.analyst.domain.model.Message;
import me.golemcore.analyst.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory session store. Sessions live for the lifetime of the process and
 * are dropped on shutdown.
 *
 * <p>
 * The map itself is the only shared structure and is never locked while a
 * planner or tool call is in flight; mutation of a single session is serialized
 * by {@link SessionLockService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService implements SessionPort {

    private final Clock clock;

    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();

    @Override
    public AgentSession create(ApprovalMode approvalMode) {
        Instant now = clock.instant();
        AgentSession session = AgentSession.builder()
                .id(UUID.randomUUID().toString())
                .approvalMode(approvalMode)
                .createdAt(now)
                .updatedAt(now)
                .build();
        sessions.put(session.getId(), session);
        log.info("Created new session: {} (mode={})", session.getId(), approvalMode.getValue());
        return session;
    }

    @Override
    public Optional<AgentSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Message appendMessage(String sessionId, Message message) {
        AgentSession session = get(sessionId).orElseThrow(() -> AgentException.notFound(sessionId));
        if (message.getTimestamp() == null) {
            message.setTimestamp(clock.instant());
        }
        return session.addMessage(message);
    }

    @Override
    public void save(AgentSession session) {
        session.setUpdatedAt(clock.instant());
        sessions.put(session.getId(), session);
        log.debug("Saved session: {}", session.getId());
    }

    @Override
    public boolean delete(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            log.info("Deleted session: {}", sessionId);
        }
        return removed;
    }

    /**
     * Collapses everything but the last {@code keepLast} messages into
     * {@code summaryMessage}. The summary takes the index of the first collapsed
     * message. If the most recent user message is among the collapsed ones it is
     * kept verbatim right after the summary.
     *
     * @return number of collapsed messages, 0 if nothing to do, -1 if the session
     *         does not exist
     */
    @Override
    public int compactWithSummary(String sessionId, int keepLast, Message summaryMessage) {
        AgentSession session = sessions.get(sessionId);
        if (session == null) {
            return -1;
        }

        List<Message> messages = session.getMessages();
        int total = messages.size();
        if (total <= keepLast) {
            return 0;
        }

        int toRemove = total - keepLast;
        Message latestUser = findLatestUserMessage(messages);
        List<Message> compacted = new ArrayList<>(keepLast + 2);
        summaryMessage.setIndex(messages.get(0).getIndex());
        if (summaryMessage.getTimestamp() == null) {
            summaryMessage.setTimestamp(clock.instant());
        }
        compacted.add(summaryMessage);

        int removed = toRemove;
        if (latestUser != null && messages.indexOf(latestUser) < toRemove) {
            compacted.add(latestUser);
            removed--;
        }
        compacted.addAll(messages.subList(toRemove, total));
        session.replaceMessages(compacted);
        session.setUpdatedAt(clock.instant());

        log.info("Compacted session {} with summary: removed {} messages, kept {} + summary",
                sessionId, removed, compacted.size() - 1);
        return removed;
    }

    @Override
    public List<Message> getMessagesToCompact(String sessionId, int keepLast) {
        AgentSession session = sessions.get(sessionId);
        if (session == null) {
            return List.of();
        }

        List<Message> messages = session.getMessages();
        int total = messages.size();
        if (total <= keepLast) {
            return List.of();
        }
        return new ArrayList<>(messages.subList(0, total - keepLast));
    }

    @Override
    public int getMessageCount(String sessionId) {
        AgentSession session = sessions.get(sessionId);
        return session != null ? session.getMessages().size() : 0;
    }

    @PreDestroy
    public void clear() {
        int count = sessions.size();
        sessions.clear();
        log.info("Dropped {} in-memory sessions", count);
    }

    private static Message findLatestUserMessage(List<Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isUserMessage()) {
                return messages.get(i);
            }
        }
        return null;
    }
}
