package me.golemcore.analyst.adapter.inbound.web.controller;

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
import me.golemcore.analyst.adapter.inbound.web.dto.CreateSessionRequest;
import me.golemcore.analyst.adapter.inbound.web.dto.PostMessageRequest;
import me.golemcore.analyst.adapter.inbound.web.dto.RunRequest;
import me.golemcore.analyst.adapter.inbound.web.dto.StopResponse;
import me.golemcore.analyst.domain.model.AgentSession;
import me.golemcore.analyst.domain.model.RunResult;
import me.golemcore.analyst.domain.model.StepResult;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.domain.service.AgentOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Agent session endpoints. Every route maps to one orchestrator operation;
 * calls that may wait on the planner or a tool run on the bounded elastic
 * scheduler.
 */
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
public class AgentController {

    private final AgentOrchestrator orchestrator;

    @PostMapping("/sessions")
    public Mono<ResponseEntity<AgentSession>> createSession(
            @RequestBody(required = false) CreateSessionRequest request) {
        String mode = request != null ? request.getApprovalMode() : null;
        return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(orchestrator.createSession(mode)));
    }

    @GetMapping("/sessions/{id}")
    public Mono<ResponseEntity<AgentSession>> getSession(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestrator.getSession(id)));
    }

    @DeleteMapping("/sessions/{id}")
    public Mono<ResponseEntity<Void>> deleteSession(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            orchestrator.deleteSession(id);
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions/{id}/messages")
    public Mono<ResponseEntity<AgentSession>> postMessage(@PathVariable String id,
            @RequestBody PostMessageRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestrator.postMessage(id, request.getContent())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions/{id}/step")
    public Mono<ResponseEntity<StepResult>> step(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestrator.step(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions/{id}/run")
    public Mono<ResponseEntity<RunResult>> run(@PathVariable String id,
            @RequestBody(required = false) RunRequest request) {
        Integer maxSteps = request != null ? request.getMaxSteps() : null;
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestrator.run(id, maxSteps)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions/{id}/approve")
    public Mono<ResponseEntity<StepResult>> approve(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestrator.approve(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions/{id}/reject")
    public Mono<ResponseEntity<StepResult>> reject(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestrator.reject(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions/{id}/stop")
    public Mono<ResponseEntity<StopResponse>> stop(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(StopResponse.builder()
                .sessionId(id)
                .runInFlight(orchestrator.requestStop(id))
                .build()));
    }

    @GetMapping("/tools")
    public Mono<ResponseEntity<List<ToolDefinition>>> listTools() {
        return Mono.just(ResponseEntity.ok(orchestrator.listTools()));
    }
}
