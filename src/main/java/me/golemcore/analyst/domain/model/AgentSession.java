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

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An investigation session: ordered event log, approval mode, at most one
 * pending action, and the {@code done} flag. State changes go through the
 * mutators below so that {@code done} and a pending action never coexist.
 * Mutators and {@link #snapshot()} synchronize on the session, so a snapshot
 * can be taken while another thread holds the session lock.
 */
@Getter
@Builder
public class AgentSession {

    private final String id;
    private final ApprovalMode approvalMode;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private PendingAction pendingAction;
    private boolean done;

    @Setter
    private String lastError;

    private final Instant createdAt;

    @Setter
    private Instant updatedAt;

    private long nextMessageIndex;

    /**
     * Appends a message, assigning the next order index.
     */
    public synchronized Message addMessage(Message message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        message.setIndex(nextMessageIndex++);
        messages.add(message);
        if (message.getTimestamp() != null) {
            this.updatedAt = message.getTimestamp();
        }
        return message;
    }

    /**
     * Replaces the message list, used by compaction. Indexes of the given messages
     * are kept as they are.
     */
    public synchronized void replaceMessages(List<Message> replacement) {
        this.messages = new ArrayList<>(replacement);
    }

    public synchronized boolean hasPendingAction() {
        return pendingAction != null;
    }

    /**
     * Stores the blocked action.
     *
     * @throws IllegalStateException
     *             if the session is done or already has a pending action
     */
    public synchronized void block(PendingAction action) {
        if (done) {
            throw new IllegalStateException("Session " + id + " is done, cannot block an action");
        }
        if (pendingAction != null) {
            throw new IllegalStateException("Session " + id + " already has a pending action");
        }
        this.pendingAction = action;
    }

    /**
     * Removes and returns the pending action, or null if none.
     */
    public synchronized PendingAction takePendingAction() {
        PendingAction action = pendingAction;
        pendingAction = null;
        return action;
    }

    /**
     * Marks the session finished.
     *
     * @throws IllegalStateException
     *             if an action is still pending
     */
    public synchronized void markDone() {
        if (pendingAction != null) {
            throw new IllegalStateException("Session " + id + " has a pending action, cannot finish");
        }
        this.done = true;
    }

    /**
     * Detached copy for callers outside the session store.
     */
    public synchronized AgentSession snapshot() {
        List<Message> copied = new ArrayList<>();
        if (messages != null) {
            for (Message message : messages) {
                copied.add(message.copy());
            }
        }
        PendingAction pendingCopy = pendingAction == null ? null : pendingAction.copy();
        return AgentSession.builder()
                .id(id)
                .approvalMode(approvalMode)
                .messages(copied)
                .pendingAction(pendingCopy)
                .done(done)
                .lastError(lastError)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .nextMessageIndex(nextMessageIndex)
                .build();
    }
}
