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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How planned tool invocations of a session are released for execution.
 */
public enum ApprovalMode {

    /**
     * Tool invocations execute within the step that planned them.
     */
    AUTO("auto"),

    /**
     * Tool invocations wait for an explicit approve call.
     */
    MANUAL("manual");

    private final String value;

    ApprovalMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses {@code auto} or {@code manual}, case-insensitive.
     *
     * @throws AgentException
     *             with {@link AgentErrorKind#INVALID_ARGUMENT} for any other value
     */
    public static ApprovalMode parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (ApprovalMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new AgentException(AgentErrorKind.INVALID_ARGUMENT,
                "approval mode must be 'auto' or 'manual', got: " + raw);
    }
}
