package com.hashkit.service.counting;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.slf4j.LoggerFactory;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

/**
 * Unit tests for count-key anagram grouping.
 */
class CountKeyGroupingServiceTest {

    private CountKeyGroupingService service;

    @BeforeEach
    void setUp() {
        service = new CountKeyGroupingService();
    }

    @Test
    void testGroups() {
        List<List<String>> groups = service.group(List.of("act", "pots", "tops", "cat", "stop", "hat"));

        assertEquals(List.of(
            List.of("act", "cat"),
            List.of("pots", "tops", "stop"),
            List.of("hat")), groups);
    }

    @Test
    void testSingleAndEmptyString() {
        assertEquals(List.of(List.of("x")), service.group(List.of("x")));
        assertEquals(List.of(List.of("")), service.group(List.of("")));
        assertEquals(List.of(List.of("", ""), List.of("a")), service.group(List.of("", "a", "")));
    }

    @Test
    void testEmptyInput() {
        assertTrue(service.group(List.of()).isEmpty());
    }

    @Test
    void testUppercaseRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.group(List.of("abc", "Cab")));
    }

    @Test
    void testLogsEachCallAtDebug() {
        Logger logger = (Logger) LoggerFactory.getLogger(CountKeyGroupingService.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            service.group(List.of("ab", "ba"));
        } finally {
            logger.detachAppender(appender);
        }

        assertEquals(1, appender.list.size());
        assertEquals(Level.DEBUG, appender.list.get(0).getLevel());
        assertEquals("Grouped 2 strings into 1 groups", appender.list.get(0).getFormattedMessage());
    }
}
