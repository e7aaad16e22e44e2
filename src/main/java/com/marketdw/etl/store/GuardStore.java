package com.marketdw.etl.store;

import com.marketdw.etl.model.GuardRecord;
import com.marketdw.etl.model.RunStatus;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface GuardStore {

    Optional<GuardRecord> find(String taskName, String idempotencyKey) throws SQLException;

    /**
     * RUNNING resets {@code started_at}; SUCCESS and FAILED stamp {@code finished_at}.
     */
    void upsert(String taskName, String idempotencyKey, RunStatus status, int attempt, int timeoutSec, String errMsg)
            throws SQLException;

    List<GuardRecord> listRunning() throws SQLException;

    int markAbandoned(long id, String errMsg, Instant finishedAt) throws SQLException;
}
