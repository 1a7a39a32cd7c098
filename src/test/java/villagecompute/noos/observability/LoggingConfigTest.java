/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.jboss.logging.MDC;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link LoggingConfig} MDC handling.
 */
class LoggingConfigTest {

    @AfterEach
    void tearDown() {
        LoggingConfig.clearMDC();
    }

    @Test
    void testStartRun_setsRunIdAndCommand() {
        String runId = LoggingConfig.startRun("dump");

        assertEquals(runId, LoggingConfig.currentRunId());
        assertEquals("dump", MDC.get(LoggingConfig.MDC_COMMAND));
    }

    @Test
    void testStartRun_generatesFreshIds() {
        String first = LoggingConfig.startRun("dump");
        String second = LoggingConfig.startRun("dump");

        assertNotEquals(first, second);
    }

    @Test
    void testClearMDC_removesAllKeys() {
        LoggingConfig.startRun("serve");
        LoggingConfig.setFeedUrl("https://a.example/rss");

        LoggingConfig.clearMDC();

        assertNull(LoggingConfig.currentRunId());
        assertNull(MDC.get(LoggingConfig.MDC_COMMAND));
        assertNull(MDC.get(LoggingConfig.MDC_FEED_URL));
    }

    @Test
    void testClearFeedUrl_keepsRunId() {
        String runId = LoggingConfig.startRun("dump");
        LoggingConfig.setFeedUrl("https://a.example/rss");

        LoggingConfig.clearFeedUrl();

        assertNull(MDC.get(LoggingConfig.MDC_FEED_URL));
        assertEquals(runId, LoggingConfig.currentRunId());
    }
}
