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
import me.golemcore.analyst.domain.model.AgentSession;
import me.golemcore.analyst.domain.model.ApprovalMode;
import me.golemcore.analyst.domain.model.Message;
import me.golemcore.analyst.domain.model.PendingAction;
import me.golemcore.analyst.domain.model.PlanDecision;
import me.golemcore.analyst.domain.model.RunResult;
import me.golemcore.analyst.domain.model.StepResult;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.domain.model.ToolExecutionOutcome;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import me.golemcore.analyst.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for agent operations. Drives the plan, gate, execute cycle one
 * step at a time and keeps each session consistent: at most one pending
 * action, no pending action on a finished session, and no state change applied
 * by a failed operation.
 *
 * <p>
 * Every mutating operation runs under the session lock; {@link #run} takes the
 * lock per step so that {@link #requestStop} and readers are never starved.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentOrchestrator {

    private final SessionPort sessionPort;
    private final SessionLockService lockService;
    private final CompactionService compactionService;
    private final PlanningService planningService;
    private final ApprovalGate approvalGate;
    private final ToolExecutionService toolExecutionService;
    private final ToolRegistry toolRegistry;
    private final AnalystProperties properties;
    private final Clock clock;

    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
    private final Set<String> stopRequests = ConcurrentHashMap.newKeySet();

    public AgentSession createSession(String approvalMode) {
        String raw = approvalMode == null || approvalMode.isBlank()
                ? properties.getAgent().getDefaultApprovalMode()
                : approvalMode;
        ApprovalMode mode = ApprovalMode.parse(raw);
        return sessionPort.create(mode).snapshot();
    }

    /**
     * Appends a user message. A finished session records it but stays finished.
     */
    public AgentSession postMessage(String sessionId, String content) {
        if (content == null || content.isBlank()) {
            throw new AgentException(AgentErrorKind.INVALID_ARGUMENT, "message content must not be blank");
        }
        return lockService.withLock(sessionId, () -> {
            AgentSession session = require(sessionId);
            sessionPort.appendMessage(sessionId, Message.user(content, clock.instant()));
            sessionPort.save(session);
            return session.snapshot();
        });
    }

    public AgentSession getSession(String sessionId) {
        return require(sessionId).snapshot();
    }

    public List<ToolDefinition> listTools() {
        return toolRegistry.list();
    }

    /**
     * Performs one plan, gate, act cycle.
     *
     * @throws AgentException
     *             {@code NOT_FOUND}, {@code SESSION_DONE},
     *             {@code ACTION_ALREADY_PENDING} or {@code SESSION_BUSY}
     */
    public StepResult step(String sessionId) {
        return lockService.withLock(sessionId, () -> doStep(sessionId));
    }

    /**
     * Repeats {@link #step} until the session finishes, blocks on approval, the
     * step limit is reached, or the run is stopped.
     *
     * @param maxSteps
     *            null for the configured default
     */
    public RunResult run(String sessionId, Integer maxSteps) {
        int limit = resolveMaxSteps(maxSteps);
        require(sessionId);
        if (!activeRuns.add(sessionId)) {
            throw new AgentException(AgentErrorKind.SESSION_BUSY, "Session " + sessionId + " is already running");
        }
        stopRequests.remove(sessionId);
        Instant deadline = clock.instant().plus(properties.getAgent().getRunDeadline());
        List<StepResult> steps = new ArrayList<>();
        try {
            RunResult.Status status = RunResult.Status.STEP_LIMIT_REACHED;
            String stopReason = "step limit of " + limit + " reached";
            for (int i = 0; i < limit; i++) {
                StepResult step = step(sessionId);
                steps.add(step);
                if (step.getStatus() == StepResult.Status.FINAL) {
                    status = RunResult.Status.FINAL;
                    stopReason = null;
                    break;
                }
                if (step.getStatus() == StepResult.Status.AWAITING_APPROVAL) {
                    status = RunResult.Status.AWAITING_APPROVAL;
                    stopReason = null;
                    break;
                }
                if (stopRequests.contains(sessionId)) {
                    status = RunResult.Status.STOPPED;
                    stopReason = "stop requested";
                    break;
                }
                if (!clock.instant().isBefore(deadline)) {
                    status = RunResult.Status.STOPPED;
                    stopReason = "run deadline exceeded";
                    break;
                }
            }
            log.info("[Agent] Session {} run ended: {} after {} steps", sessionId, status.getValue(), steps.size());
            return RunResult.builder()
                    .status(status)
                    .steps(steps)
                    .planningCalls(steps.size())
                    .stopReason(stopReason)
                    .session(getSession(sessionId))
                    .build();
        } finally {
            activeRuns.remove(sessionId);
            stopRequests.remove(sessionId);
        }
    }

    /**
     * Executes the pending action.
     *
     * @throws AgentException
     *             {@code NO_PENDING_ACTION} when nothing waits for approval
     */
    public StepResult approve(String sessionId) {
        return lockService.withLock(sessionId, () -> {
            AgentSession session = require(sessionId);
            PendingAction action = requirePendingAction(session);
            log.info("[Approval] Session {}: approved {}", sessionId, action.getToolName());
            ToolExecutionOutcome outcome = toolExecutionService.execute(sessionId, action.getToolName(),
                    action.getArguments());
            session.takePendingAction();
            sessionPort.save(session);
            return StepResult.builder()
                    .status(StepResult.Status.EXECUTED)
                    .decision(new PlanDecision.ToolInvocation(action.getToolName(), action.getArguments(), null))
                    .outcome(outcome)
                    .session(session.snapshot())
                    .build();
        });
    }

    /**
     * Discards the pending action and records the rejection in history.
     *
     * @throws AgentException
     *             {@code NO_PENDING_ACTION} when nothing waits for approval
     */
    public StepResult reject(String sessionId) {
        return lockService.withLock(sessionId, () -> {
            AgentSession session = require(sessionId);
            PendingAction action = requirePendingAction(session);
            log.info("[Approval] Session {}: rejected {}", sessionId, action.getToolName());
            ToolExecutionOutcome outcome = toolExecutionService.recordRejection(sessionId, action);
            session.takePendingAction();
            sessionPort.save(session);
            return StepResult.builder()
                    .status(StepResult.Status.DISCARDED)
                    .decision(new PlanDecision.ToolInvocation(action.getToolName(), action.getArguments(), null))
                    .outcome(outcome)
                    .session(session.snapshot())
                    .build();
        });
    }

    /**
     * Abandons the session. A pending action is discarded without execution.
     */
    public void deleteSession(String sessionId) {
        lockService.withLock(sessionId, () -> {
            AgentSession session = require(sessionId);
            PendingAction discarded = session.takePendingAction();
            if (discarded != null) {
                log.info("[Approval] Session {}: discarding pending {} on delete", sessionId,
                        discarded.getToolName());
            }
            if (activeRuns.contains(sessionId)) {
                stopRequests.add(sessionId);
            }
            return sessionPort.delete(sessionId);
        });
    }

    /**
     * Asks an in-flight {@link #run} to stop after its current step.
     *
     * @return true if a run was in flight
     */
    public boolean requestStop(String sessionId) {
        require(sessionId);
        if (!activeRuns.contains(sessionId)) {
            return false;
        }
        stopRequests.add(sessionId);
        log.info("[Agent] Stop requested for session {}", sessionId);
        return true;
    }

    private StepResult doStep(String sessionId) {
        AgentSession session = require(sessionId);
        if (session.isDone()) {
            throw new AgentException(AgentErrorKind.SESSION_DONE,
                    "Session " + sessionId + " is done; start a new session to continue");
        }
        if (session.hasPendingAction()) {
            throw new AgentException(AgentErrorKind.ACTION_ALREADY_PENDING,
                    "Session " + sessionId + " has an action awaiting approval");
        }

        compactionService.compactIfNeeded(sessionId);
        List<Message> history = new ArrayList<>(session.getMessages());
        PlanningService.PlanningOutcome planning = planningService.plan(sessionId, history, toolRegistry.list());
        if (planning.isFallback()) {
            session.setLastError("planner: " + planning.fallbackReason());
        }

        PlanDecision decision = planning.decision();
        StepResult.StepResultBuilder result = StepResult.builder()
                .decision(decision)
                .plannerSource(planning.source());

        if (decision instanceof PlanDecision.FinalAnswer answer) {
            sessionPort.appendMessage(sessionId, agentMessage(answer.answer(), Message.KIND_FINAL, answer.thought()));
            session.markDone();
            sessionPort.save(session);
            log.info("[Agent] Session {} finished ({})", sessionId, planning.source());
            return result.status(StepResult.Status.FINAL)
                    .answer(answer.answer())
                    .session(session.snapshot())
                    .build();
        }

        PlanDecision.ToolInvocation invocation = (PlanDecision.ToolInvocation) decision;
        String description = approvalGate.describe(invocation);
        if (approvalGate.evaluate(session.getApprovalMode(), invocation) == ApprovalGate.Verdict.BLOCKED) {
            PendingAction pending = PendingAction.builder()
                    .sessionId(sessionId)
                    .toolName(invocation.toolName())
                    .arguments(PendingAction.copyArguments(invocation.arguments()))
                    .description(description)
                    .createdAt(clock.instant())
                    .build();
            session.block(pending);
            sessionPort.appendMessage(sessionId,
                    agentMessage("Awaiting approval: " + description, Message.KIND_DECISION, invocation.thought()));
            sessionPort.save(session);
            log.info("[Approval] Session {}: {} awaits approval", sessionId, invocation.toolName());
            return result.status(StepResult.Status.AWAITING_APPROVAL)
                    .pendingAction(pending.copy())
                    .session(session.snapshot())
                    .build();
        }

        sessionPort.appendMessage(sessionId,
                agentMessage("Running " + description, Message.KIND_DECISION, invocation.thought()));
        ToolExecutionOutcome outcome = toolExecutionService.execute(sessionId, invocation.toolName(),
                invocation.arguments());
        sessionPort.save(session);
        return result.status(StepResult.Status.EXECUTED)
                .outcome(outcome)
                .session(session.snapshot())
                .build();
    }

    private Message agentMessage(String content, String kind, String thought) {
        Message message = Message.agent(content, kind, clock.instant());
        if (thought != null && !thought.isBlank()) {
            message.getMetadata().put(Message.META_THOUGHT, thought);
        }
        return message;
    }

    private int resolveMaxSteps(Integer maxSteps) {
        if (maxSteps == null) {
            return properties.getAgent().getDefaultMaxSteps();
        }
        int cap = properties.getAgent().getMaxStepsCap();
        if (maxSteps <= 0 || maxSteps > cap) {
            throw new AgentException(AgentErrorKind.INVALID_ARGUMENT,
                    "maxSteps must be between 1 and " + cap + ", got: " + maxSteps);
        }
        return maxSteps;
    }

    private AgentSession require(String sessionId) {
        return sessionPort.get(sessionId).orElseThrow(() -> AgentException.notFound(sessionId));
    }

    private static PendingAction requirePendingAction(AgentSession session) {
        if (!session.hasPendingAction()) {
            throw new AgentException(AgentErrorKind.NO_PENDING_ACTION,
                    "Session " + session.getId() + " has no action awaiting approval");
        }
        return session.getPendingAction();
    }
}
