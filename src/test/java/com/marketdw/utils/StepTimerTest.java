package com.marketdw.utils;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StepTimerTest {

    @Test
    void summaryShouldContainEveryFinishedStep() {
        AtomicLong clock = new AtomicLong(1_000L);
        StepTimer timer = new StepTimer(clock::get);
        timer.start("ODS");
        clock.addAndGet(250L);
        timer.end("ODS");
        timer.start("DWD");
        clock.addAndGet(40L);
        timer.end("DWD");
        timer.start("HEALTH");

        String summary = timer.summaryText();

        assertEquals(250L, timer.snapshot().get("ODS"));
        assertTrue(summary.contains(" - ODS = 250 ms"));
        assertTrue(summary.contains(" - DWD = 40 ms"));
        assertFalse(summary.contains("HEALTH"));
    }
}
