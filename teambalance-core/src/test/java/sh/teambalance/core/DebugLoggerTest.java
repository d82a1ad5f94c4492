// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.teambalance.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        LedgerDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.log("should not appear");
        DebugLogger.logWithdraw("nor this");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        LedgerDebug.setEnabled(true);
        DebugLogger.log("payload {\"privateKey\":\"0x123\"}");

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("0x***[REDACTED]***"));
    }

    @Test
    void channelsAreIndependent() {
        LedgerDebug.setWithdrawLogging(true);

        DebugLogger.logQuery("query %d", 1);
        DebugLogger.logWithdraw("withdraw %d", 2);

        assertEquals(1, appender.list.size());
        assertEquals("withdraw 2", appender.list.get(0).getFormattedMessage());
        assertTrue(LedgerDebug.isEnabled());
    }
}
