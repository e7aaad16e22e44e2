package com.marketdw.etl.guard;

import com.marketdw.etl.model.GuardRecord;
import com.marketdw.etl.model.RunStatus;
import com.marketdw.etl.store.GuardStore;
import com.marketdw.utils.Sleeper;
import com.marketdw.utils.TextFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs a command at most once to success per (task name, idempotency key).
 * <p>
 * A SUCCESS record short-circuits every later call. Otherwise each attempt is recorded RUNNING, then
 * SUCCESS or FAILED, with {@code retries} further attempts after the first one.
 * Two processes racing on the same key can both run; there is no lock.
 */
public final class IdempotencyGuard {
    private static final Logger LOG = LogManager.getLogger(IdempotencyGuard.class);
    static final int MAX_ERROR_CHARS = 2000;

    private final GuardStore store;
    private final Sleeper sleeper;

    public IdempotencyGuard(GuardStore store, Sleeper sleeper) {
        this.store = store;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public GuardOutcome execute(
            String taskName,
            String idempotencyKey,
            GuardCommand command,
            int retries,
            Duration retryDelay,
            Duration timeout
    ) throws SQLException, InterruptedException {
        if (TextFormatter.isBlank(taskName) || TextFormatter.isBlank(idempotencyKey)) {
            throw new IllegalArgumentException("task name and idempotency key are required");
        }
        Optional<GuardRecord> existing = store.find(taskName, idempotencyKey);
        if (existing.isPresent() && existing.get().status == RunStatus.SUCCESS) {
            LOG.info("guard skip task={} key={} reason=already_succeeded attempt={}",
                    taskName, idempotencyKey, existing.get().attempt);
            return new GuardOutcome(taskName, idempotencyKey, GuardOutcome.Kind.SKIPPED, 0, null);
        }

        int maxAttempts = Math.max(0, retries) + 1;
        int timeoutSec = (int) Math.max(1L, timeout.getSeconds());
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            store.upsert(taskName, idempotencyKey, RunStatus.RUNNING, attempt, timeoutSec, null);
            LOG.info("guard attempt start task={} key={} attempt={}/{} timeout_sec={}",
                    taskName, idempotencyKey, attempt, maxAttempts, timeoutSec);
            lastError = runAttempt(command, timeout);
            if (lastError == null) {
                store.upsert(taskName, idempotencyKey, RunStatus.SUCCESS, attempt, timeoutSec, null);
                LOG.info("guard attempt success task={} key={} attempt={}", taskName, idempotencyKey, attempt);
                return new GuardOutcome(taskName, idempotencyKey, GuardOutcome.Kind.SUCCEEDED, attempt, null);
            }
            store.upsert(taskName, idempotencyKey, RunStatus.FAILED, attempt, timeoutSec, lastError);
            LOG.warn("guard attempt failed task={} key={} attempt={}/{} err={}",
                    taskName, idempotencyKey, attempt, maxAttempts, lastError);
            if (attempt < maxAttempts && retryDelay != null && !retryDelay.isZero()) {
                LOG.info("guard retry in {}s task={} key={}", retryDelay.getSeconds(), taskName, idempotencyKey);
                sleeper.sleep(retryDelay);
            }
        }
        LOG.error("guard exhausted task={} key={} attempts={}", taskName, idempotencyKey, maxAttempts);
        return new GuardOutcome(taskName, idempotencyKey, GuardOutcome.Kind.FAILED, maxAttempts, lastError);
    }

    /**
     * @return null on success, otherwise the error excerpt to persist
     */
    private String runAttempt(GuardCommand command, Duration timeout) throws InterruptedException {
        try {
            CommandResult result = command.run(timeout);
            if (result.succeeded()) {
                return null;
            }
            return TextFormatter.head("exit_code=" + result.exitCode + "; output_tail=" + result.outputTail, MAX_ERROR_CHARS);
        } catch (TimeoutException e) {
            String tail = e.getMessage() == null ? "" : e.getMessage();
            return TextFormatter.head("timeout_after=" + timeout.getSeconds() + "s; output_tail=" + tail, MAX_ERROR_CHARS);
        } catch (IOException e) {
            return TextFormatter.head("launch_failed: " + e.getMessage(), MAX_ERROR_CHARS);
        }
    }
}
