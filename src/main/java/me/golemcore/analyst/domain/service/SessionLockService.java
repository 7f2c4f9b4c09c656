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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.domain.model.AgentErrorKind;
import me.golemcore.analyst.domain.model.AgentException;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-session mutual exclusion. Operations on one session run one at a time,
 * different sessions proceed in parallel. Waiting is bounded by
 * {@code analyst.agent.session-lock-timeout}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLockService {

    private final AnalystProperties properties;

    private final Map<String, SessionLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} while holding the lock of the given session. The lock
     * entry lives only while some caller holds or waits for it.
     *
     * @throws AgentException
     *             {@code SESSION_BUSY} if the lock could not be acquired in time
     */
    public <T> T withLock(String sessionId, Supplier<T> action) {
        SessionLock entry = locks.compute(sessionId, (id, existing) -> {
            SessionLock current = existing != null ? existing : new SessionLock();
            current.users++;
            return current;
        });
        try {
            return runLocked(sessionId, entry.lock, action);
        } finally {
            locks.computeIfPresent(sessionId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    private <T> T runLocked(String sessionId, ReentrantLock lock, Supplier<T> action) {
        Duration timeout = properties.getAgent().getSessionLockTimeout();
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException(AgentErrorKind.SESSION_BUSY,
                    "Interrupted while waiting for session " + sessionId);
        }
        if (!acquired) {
            log.warn("[Session] Lock wait timed out after {} ms for session {}", timeout.toMillis(), sessionId);
            throw new AgentException(AgentErrorKind.SESSION_BUSY,
                    "Session " + sessionId + " is busy with another operation");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int trackedLocks() {
        return locks.size();
    }

    // users is only touched inside ConcurrentHashMap.compute for the same key
    private static final class SessionLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
