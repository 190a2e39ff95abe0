package com.shannon.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setAgent puts sessionId and agent in MDC")
    void setAgent() {
        MdcContext.setAgent("s-1", "recon");
        assertEquals("s-1", MDC.get("sessionId"));
        assertEquals("recon", MDC.get("agent"));
    }

    @Test
    @DisplayName("clearAgent keeps the session")
    void clearAgent() {
        MdcContext.setAgent("s-1", "recon");
        MdcContext.setAttempt(2);
        MdcContext.clearAgent();
        assertEquals("s-1", MDC.get("sessionId"));
        assertNull(MDC.get("agent"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("clear removes all shannon MDC keys")
    void clear() {
        MdcContext.setAgent("s-1", "recon");
        MdcContext.setAttempt(1);
        MdcContext.setWave("s-1", "initial-footprinting");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("agent"));
        assertNull(MDC.get("attempt"));
        assertNull(MDC.get("wave"));
    }
}
