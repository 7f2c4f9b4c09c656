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
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a single step, approve, or reject call. Which fields are set
 * depends on {@link Status}: {@code outcome} for EXECUTED and DISCARDED,
 * {@code answer} for FINAL, {@code pendingAction} for AWAITING_APPROVAL.
 */
@Data
@Builder
public class StepResult {

    private Status status;
    private PlanDecision decision;
    private PlannerSource plannerSource;
    private ToolExecutionOutcome outcome;
    private String answer;
    private PendingAction pendingAction;
    private AgentSession session;

    public enum Status {
        EXECUTED("executed"), FINAL("final"), AWAITING_APPROVAL("awaiting_approval"), DISCARDED("discarded");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    public enum PlannerSource {
        LLM, FALLBACK
    }
}
