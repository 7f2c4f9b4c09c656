package me.golemcore.analyst.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalModeTest {

    @Test
    void shouldParseCaseInsensitively() {
        assertEquals(ApprovalMode.AUTO, ApprovalMode.parse("auto"));
        assertEquals(ApprovalMode.MANUAL, ApprovalMode.parse(" Manual "));
    }

    @Test
    void shouldRejectUnknownMode() {
        AgentException ex = assertThrows(AgentException.class, () -> ApprovalMode.parse("semi"));

        assertEquals(AgentErrorKind.INVALID_ARGUMENT, ex.getKind());
        assertThrows(AgentException.class, () -> ApprovalMode.parse(null));
    }
}
