package com.marketdw.etl.runner;

import com.marketdw.etl.model.UnitRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProcessChunkLauncherTest {

    @Test
    void commandShouldRunChunkIncrementallyWithWatermarkDisabled() {
        ProcessChunkLauncher launcher = new ProcessChunkLauncher("/opt/jdk/bin/java", "app.jar", "com.example.Main",
                List.of("--batch-threshold", "30"));

        List<String> cmd = launcher.buildCommand("dwd", UnitRange.of(20230101, 20231231));

        assertEquals(List.of(
                "/opt/jdk/bin/java", "-cp", "app.jar", "com.example.Main",
                "--layer", "dwd",
                "--mode", "incremental",
                "--start-date", "20230101",
                "--end-date", "20231231",
                "--disable-watermark",
                "--batch-threshold", "30"
        ), cmd);
    }

    @Test
    void emptyClasspathShouldBeOmitted() {
        ProcessChunkLauncher launcher = new ProcessChunkLauncher("java", "", "com.example.Main", null);

        List<String> cmd = launcher.buildCommand("ods", UnitRange.single(20240105));

        assertEquals("com.example.Main", cmd.get(1));
        assertEquals("--disable-watermark", cmd.get(cmd.size() - 1));
    }
}
