package com.marketdw.etl.runner;

import com.marketdw.etl.calendar.TradeDates;
import com.marketdw.etl.model.UnitRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-invokes the CLI in a child JVM for one chunk. The child shares nothing with the parent but the database.
 */
public final class ProcessChunkLauncher implements ChunkLauncher {
    private static final Logger LOG = LogManager.getLogger(ProcessChunkLauncher.class);

    private final String javaBinary;
    private final String classpath;
    private final String mainClass;
    private final List<String> extraArgs;

    public ProcessChunkLauncher(String javaBinary, String classpath, String mainClass, List<String> extraArgs) {
        this.javaBinary = javaBinary;
        this.classpath = classpath;
        this.mainClass = mainClass;
        this.extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
    }

    /**
     * Launcher for the running JVM's own binary and classpath.
     */
    public static ProcessChunkLauncher forCurrentJvm(String mainClass, List<String> extraArgs) {
        String javaHome = System.getProperty("java.home");
        String java = Path.of(javaHome, "bin", "java").toString();
        String cp = System.getProperty("java.class.path", "");
        return new ProcessChunkLauncher(java, cp, mainClass, extraArgs);
    }

    List<String> buildCommand(String layerName, UnitRange chunk) {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaBinary);
        if (!classpath.isEmpty()) {
            cmd.add("-cp");
            cmd.add(classpath);
        }
        cmd.add(mainClass);
        cmd.add("--layer");
        cmd.add(layerName);
        cmd.add("--mode");
        cmd.add("incremental");
        cmd.add("--start-date");
        cmd.add(TradeDates.format(chunk.first));
        cmd.add("--end-date");
        cmd.add(TradeDates.format(chunk.last));
        cmd.add("--disable-watermark");
        cmd.addAll(extraArgs);
        return cmd;
    }

    @Override
    public int launch(String layerName, UnitRange chunk) throws IOException, InterruptedException {
        List<String> cmd = buildCommand(layerName, chunk);
        LOG.info("chunk worker start layer={} chunk={} cmd={}", layerName, chunk, String.join(" ", cmd));
        Process process = new ProcessBuilder(cmd)
                .directory(new File(".").getAbsoluteFile())
                .inheritIO()
                .start();
        try {
            int exit = process.waitFor();
            LOG.info("chunk worker exit layer={} chunk={} exit_code={}", layerName, chunk, exit);
            return exit;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }
}
