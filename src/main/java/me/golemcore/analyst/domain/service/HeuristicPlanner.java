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

import me.golemcore.analyst.domain.model.Message;
import me.golemcore.analyst.domain.model.PlanDecision;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Deterministic planner used when the reasoning backend is unavailable or
 * misbehaves. Always finishes: the answer restates the most recent goal, the
 * latest tool evidence gathered for it, and fixed next steps. The same history
 * always yields the same answer.
 */
@Component
public class HeuristicPlanner {

    static final String THOUGHT = "Reasoning backend unavailable, answering from collected evidence.";

    private static final int MAX_GOAL_CHARS = 500;
    private static final int MAX_EVIDENCE_CHARS = 1500;

    private static final List<String> NEXT_STEPS = List.of(
            "Query recent alerts for the affected hosts and users with es_search.",
            "Check source IP addresses against threat intelligence.",
            "Review authentication logs around the first and last occurrence.");

    public PlanDecision.FinalAnswer plan(List<Message> history) {
        Message goal = null;
        int goalPosition = -1;
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).isUserMessage()) {
                goal = history.get(i);
                goalPosition = i;
                break;
            }
        }

        Message evidence = null;
        for (int i = history.size() - 1; i > goalPosition; i--) {
            if (history.get(i).isToolMessage()) {
                evidence = history.get(i);
                break;
            }
        }

        StringBuilder answer = new StringBuilder("Heuristic assessment (automated reasoning unavailable).\n");
        if (goal != null) {
            answer.append("Goal: ").append(truncate(goal.getContent(), MAX_GOAL_CHARS)).append('\n');
        } else {
            answer.append("Goal: none stated.\n");
        }
        if (evidence != null) {
            answer.append("Latest evidence (").append(evidence.getToolName()).append("): ")
                    .append(truncate(evidence.getContent(), MAX_EVIDENCE_CHARS)).append('\n');
        } else {
            answer.append("No tool evidence collected yet.\n");
        }
        answer.append("Suggested next steps:");
        for (int i = 0; i < NEXT_STEPS.size(); i++) {
            answer.append('\n').append(i + 1).append(". ").append(NEXT_STEPS.get(i));
        }
        return new PlanDecision.FinalAnswer(answer.toString(), THOUGHT);
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        String stripped = text.strip();
        return stripped.length() <= maxLen ? stripped : stripped.substring(0, maxLen) + "...";
    }
}
