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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single decision a planner returns for one step: either invoke a named
 * tool with arguments, or finish with an answer.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PlanDecision.ToolInvocation.class, name = "tool"),
        @JsonSubTypes.Type(value = PlanDecision.FinalAnswer.class, name = "final")
})
public sealed interface PlanDecision permits PlanDecision.ToolInvocation, PlanDecision.FinalAnswer {

    /**
     * Planner's free-form reasoning for this decision, may be null.
     */
    String thought();

    /**
     * @param toolName
     *            registered tool name
     * @param arguments
     *            arguments matching the tool's input schema
     * @param thought
     *            optional reasoning
     */
    record ToolInvocation(String toolName, Map<String, Object> arguments, String thought) implements PlanDecision {

        public ToolInvocation {
            arguments = arguments != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                    : Map.of();
        }
    }

    /**
     * @param answer
     *            final answer text
     * @param thought
     *            optional reasoning
     */
    record FinalAnswer(String answer, String thought) implements PlanDecision {
    }
}
