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

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a bounded run: the terminal status, the per-step trace and the
 * session as it stood when the loop ended.
 */
@Data
@Builder
public class RunResult {

    private Status status;

    @Builder.Default
    private List<StepResult> steps = new ArrayList<>();

    private int planningCalls;
    private String stopReason;
    private AgentSession session;

    public enum Status {
        FINAL("final"), AWAITING_APPROVAL("awaiting_approval"), STEP_LIMIT_REACHED("step_limit_reached"),
        STOPPED("stopped");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
