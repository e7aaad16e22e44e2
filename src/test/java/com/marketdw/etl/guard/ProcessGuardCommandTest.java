package com.marketdw.etl.guard;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessGuardCommandTest {

    @Test
    void exitCodeAndOutputShouldBeCaptured() throws Exception {
        ProcessGuardCommand command = new ProcessGuardCommand(List.of("sh", "-c", "echo loaded; echo broken >&2; exit 3"));

        CommandResult result = command.run(Duration.ofSeconds(10));

        assertEquals(3, result.exitCode);
        assertEquals("stdout: loaded | stderr: broken", result.outputTail);
    }

    @Test
    void overrunningCommandShouldBeKilled() {
        ProcessGuardCommand command = new ProcessGuardCommand(List.of("sh", "-c", "echo started; sleep 30"));

        TimeoutException error = assertThrows(TimeoutException.class, () -> command.run(Duration.ofSeconds(1)));

        assertTrue(error.getMessage().contains("started"));
    }

    @Test
    void emptyCommandShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessGuardCommand(List.of()));
    }
}
