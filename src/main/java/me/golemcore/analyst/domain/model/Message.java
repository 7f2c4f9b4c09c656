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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single entry of a session's event log: a user message, a planner decision
 * or final answer ({@code agent}), or a tool outcome ({@code tool}). The
 * {@code index} is assigned by the session on append and keeps growing across
 * compaction, so ordering is always recoverable.
 */
@Data
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_AGENT = "agent";
    public static final String ROLE_TOOL = "tool";

    public static final String META_KIND = "kind";
    public static final String META_THOUGHT = "thought";

    public static final String KIND_DECISION = "decision";
    public static final String KIND_FINAL = "final";
    public static final String KIND_SUMMARY = "summary";
    public static final String KIND_DISCARDED = "discarded";

    private long index;
    private String role;
    private String content;

    private String toolName; // tool messages only
    private Map<String, Object> data; // structured tool payload

    private Map<String, Object> metadata;
    private Instant timestamp;

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAgentMessage() {
        return ROLE_AGENT.equals(role);
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Returns the {@code kind} metadata entry, or null.
     */
    public String getKind() {
        if (metadata == null) {
            return null;
        }
        Object kind = metadata.get(META_KIND);
        return kind != null ? kind.toString() : null;
    }

    /**
     * Copy with its own metadata map, safe to hand out of the session store.
     */
    public Message copy() {
        return toBuilder()
                .data(data != null ? new LinkedHashMap<>(data) : null)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : null)
                .build();
    }

    public static Message user(String content, Instant timestamp) {
        return Message.builder()
                .role(ROLE_USER)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    public static Message agent(String content, String kind, Instant timestamp) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_KIND, kind);
        return Message.builder()
                .role(ROLE_AGENT)
                .content(content)
                .metadata(metadata)
                .timestamp(timestamp)
                .build();
    }
}
