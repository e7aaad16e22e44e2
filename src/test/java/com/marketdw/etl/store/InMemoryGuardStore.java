package com.marketdw.etl.store;

import com.marketdw.etl.model.GuardRecord;
import com.marketdw.etl.model.RunStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryGuardStore implements GuardStore {
    private final Map<String, GuardRecord> rows = new LinkedHashMap<>();
    private final List<RunStatus> transitions = new ArrayList<>();
    private long nextId = 1L;
    private Instant now = Instant.parse("2024-01-10T08:00:00Z");

    public void setNow(Instant now) {
        this.now = now;
    }

    public GuardRecord seed(String task, String key, RunStatus status, int attempt, Instant startedAt) {
        GuardRecord record = new GuardRecord(nextId++, task, key, status, attempt, startedAt,
                status.isTerminal() ? startedAt : null, 0, null);
        rows.put(task + "/" + key, record);
        return record;
    }

    @Override
    public Optional<GuardRecord> find(String taskName, String idempotencyKey) {
        return Optional.ofNullable(rows.get(taskName + "/" + idempotencyKey));
    }

    @Override
    public void upsert(String taskName, String idempotencyKey, RunStatus status, int attempt, int timeoutSec, String errMsg) {
        String k = taskName + "/" + idempotencyKey;
        GuardRecord existing = rows.get(k);
        long id = existing == null ? nextId++ : existing.id;
        Instant startedAt = status == RunStatus.RUNNING || existing == null ? now : existing.startedAt;
        Instant finishedAt = status.isTerminal() ? now : null;
        rows.put(k, new GuardRecord(id, taskName, idempotencyKey, status, attempt, startedAt, finishedAt, timeoutSec, errMsg));
        transitions.add(status);
    }

    @Override
    public List<GuardRecord> listRunning() {
        List<GuardRecord> out = new ArrayList<>();
        for (GuardRecord row : rows.values()) {
            if (row.status == RunStatus.RUNNING) {
                out.add(row);
            }
        }
        return out;
    }

    @Override
    public int markAbandoned(long id, String errMsg, Instant finishedAt) {
        for (Map.Entry<String, GuardRecord> e : rows.entrySet()) {
            GuardRecord row = e.getValue();
            if (row.id == id && row.status == RunStatus.RUNNING) {
                e.setValue(new GuardRecord(id, row.taskName, row.idempotencyKey, RunStatus.FAILED, row.attempt,
                        row.startedAt, finishedAt, row.timeoutSec, errMsg));
                return 1;
            }
        }
        return 0;
    }

    public List<RunStatus> transitions() {
        return new ArrayList<>(transitions);
    }
}
