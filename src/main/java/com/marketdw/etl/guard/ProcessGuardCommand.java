package com.marketdw.etl.guard;

import com.marketdw.utils.TextFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command as a child process with a hard timeout.
 * stdout and stderr go to temp files so a chatty child can never block on a full pipe.
 */
public final class ProcessGuardCommand implements GuardCommand {
    private static final Logger LOG = LogManager.getLogger(ProcessGuardCommand.class);
    static final int TAIL_CHARS = 1000;
    static final int TIMEOUT_TAIL_CHARS = 800;

    private final List<String> command;

    public ProcessGuardCommand(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("guard command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    public List<String> command() {
        return command;
    }

    @Override
    public CommandResult run(Duration timeout) throws IOException, InterruptedException, TimeoutException {
        Path out = Files.createTempFile("marketdw-guard-", ".out");
        Path err = Files.createTempFile("marketdw-guard-", ".err");
        try {
            Process process = new ProcessBuilder(command)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();
            boolean finished;
            try {
                finished = process.waitFor(Math.max(1L, timeout.getSeconds()), TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                LOG.warn("guard command timed out after {}s cmd={}", timeout.getSeconds(), String.join(" ", command));
                throw new TimeoutException(outputTail(out, err, TIMEOUT_TAIL_CHARS));
            }
            return new CommandResult(process.exitValue(), outputTail(out, err, TAIL_CHARS));
        } finally {
            Files.deleteIfExists(out);
            Files.deleteIfExists(err);
        }
    }

    private static String outputTail(Path out, Path err, int maxChars) throws IOException {
        String stdout = TextFormatter.tail(Files.readString(out, StandardCharsets.UTF_8), maxChars);
        String stderr = TextFormatter.tail(Files.readString(err, StandardCharsets.UTF_8), maxChars);
        StringBuilder sb = new StringBuilder();
        if (!stdout.isEmpty()) {
            sb.append("stdout: ").append(stdout);
        }
        if (!stderr.isEmpty()) {
            if (sb.length() > 0) {
                sb.append(" | ");
            }
            sb.append("stderr: ").append(stderr);
        }
        return sb.toString();
    }
}
