package me.golemcore.analyst.adapter.inbound.web;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.analyst.domain.model.AgentErrorKind;
import me.golemcore.analyst.domain.model.AgentException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps agent errors to HTTP responses with an {@link ApiErrorResponse} body.
 *
 * <ul>
 * <li>NOT_FOUND - 404</li>
 * <li>SESSION_DONE, ACTION_ALREADY_PENDING, NO_PENDING_ACTION - 409</li>
 * <li>INVALID_ARGUMENT, UNKNOWN_TOOL, INVALID_ARGUMENTS - 400</li>
 * <li>SESSION_BUSY - 423</li>
 * </ul>
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AgentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleAgentException(AgentException ex) {
        HttpStatus status = statusFor(ex.getKind());
        log.warn("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .kind(ex.getKind().name())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    static HttpStatus statusFor(AgentErrorKind kind) {
        return switch (kind) {
        case NOT_FOUND -> HttpStatus.NOT_FOUND;
        case SESSION_DONE, ACTION_ALREADY_PENDING, NO_PENDING_ACTION -> HttpStatus.CONFLICT;
        case INVALID_ARGUMENT, UNKNOWN_TOOL, INVALID_ARGUMENTS -> HttpStatus.BAD_REQUEST;
        case SESSION_BUSY -> HttpStatus.LOCKED;
        };
    }
}
