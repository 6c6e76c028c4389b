package com.nexuslog.sdk.client;

import com.nexuslog.sdk.model.Level;
import com.nexuslog.sdk.model.LogEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockNexusLoggerTest {

    private MockNexusLogger logger;

    @BeforeEach
    void setUp() {
        logger = new MockNexusLogger("checkout");
    }

    // --- Constructor & initialization ---

    @Test
    void defaultConstructorCreatesDetachedLogger() {
        MockNexusLogger mock = new MockNexusLogger();
        assertThat(mock.getCapturedEntries()).isEmpty();
        assertThat(mock.getSinkKey()).isNull();
        assertThat(mock.getLevel()).isEqualTo(Level.TRACE);
    }

    // --- Capturing ---

    @Test
    void capturesEntriesInCallOrder() {
        logger.info("first");
        logger.warn("second");
        logger.error("third");

        assertThat(logger.getMessages()).containsExactly("first", "second", "third");
    }

    @Test
    void capturedEntriesCarryNameLevelAndTimestamp() {
        long before = System.currentTimeMillis() / 1000;
        logger.debug("details");

        LogEntry entry = logger.getCapturedEntries().get(0);
        assertThat(entry.getName()).isEqualTo("checkout");
        assertThat(entry.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(entry.getTimestamp().seconds()).isGreaterThanOrEqualTo(before - 1);
    }

    @Test
    void assertLoggedMatchesTextWithUnpairedSurrogate() {
        String odd = "half a pair \uDC00";
        logger.info(odd);

        logger.assertLogged(Level.INFO, odd);
        assertThat(logger.getMessages()).containsExactly(odd);
    }

    @Test
    void longMessagesAreCapturedWhole() {
        String big = "z".repeat(1000);
        logger.info(big);

        LogEntry entry = logger.getCapturedEntries().get(0);
        assertThat(entry.getMessage().isInline()).isFalse();
        assertThat(entry.getMessage().asString()).isEqualTo(big);
    }

    // --- Level filtering ---

    @Test
    void respectsMinimumLevel() {
        MockNexusLogger warnOnly = new MockNexusLogger("svc", Level.WARN);
        warnOnly.info("dropped");
        warnOnly.warn("kept");

        warnOnly.assertEntryCount(1);
        warnOnly.assertLogged(Level.WARN, "kept");
    }

    @Test
    void levelCanBeRaisedAtRuntime() {
        logger.setLevel(Level.ERROR);
        logger.warn("dropped");
        logger.error("kept");

        assertThat(logger.getEntriesAt(Level.ERROR)).hasSize(1);
        assertThat(logger.getEntriesAt(Level.WARN)).isEmpty();
    }

    // --- Assertions & reset ---

    @Test
    void assertEntryCountFailsOnMismatch() {
        logger.info("one");
        assertThatThrownBy(() -> logger.assertEntryCount(2))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Expected 2 entries but found 1");
    }

    @Test
    void assertLoggedFailsWhenMissing() {
        logger.info("present");
        assertThatThrownBy(() -> logger.assertLogged(Level.ERROR, "present"))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("error");
    }

    @Test
    void resetClearsCapturedEntries() {
        logger.info("one");
        logger.reset();
        assertThat(logger.getCapturedEntries()).isEmpty();
    }

    @Test
    void closeAndFlushAreSafeWithoutSink() {
        logger.flush();
        logger.close();
        logger.info("after close");

        assertThat(logger.isClosed()).isTrue();
        assertThat(logger.getCapturedEntries()).isEmpty();
        assertThat(logger.getMetrics().entriesWritten).isZero();
    }
}
