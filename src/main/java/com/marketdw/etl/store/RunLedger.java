package com.marketdw.etl.store;

import com.marketdw.etl.model.RunLogRecord;
import com.marketdw.etl.model.RunStatus;
import com.marketdw.etl.model.RunType;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Append/close log of job executions. Every call commits on its own, independent of unit transactions.
 */
public interface RunLedger {

    long start(String streamName, RunType runType) throws SQLException;

    /**
     * Closes a RUNNING row. A row that was already closed is left as it is.
     */
    void finish(long runId, RunStatus status, String errMsg, int requestCount, int failCount) throws SQLException;

    List<RunLogRecord> listRecent(int limit) throws SQLException;

    List<RunLogRecord> listRunning() throws SQLException;

    /**
     * Moves a still-RUNNING row to FAILED with the given message.
     *
     * @return number of rows changed, 0 when the row finished in the meantime
     */
    int markAbandoned(long runId, String errMsg, Instant endAt) throws SQLException;
}
