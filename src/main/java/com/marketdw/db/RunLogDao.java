package com.marketdw.db;

import com.marketdw.db.mybatis.MyBatisSupport;
import com.marketdw.db.mybatis.RunLogFinishParam;
import com.marketdw.db.mybatis.RunLogInsertParam;
import com.marketdw.db.mybatis.RunLogMapper;
import com.marketdw.db.mybatis.RunLogRow;
import com.marketdw.etl.model.RunLogRecord;
import com.marketdw.etl.model.RunStatus;
import com.marketdw.etl.model.RunType;
import com.marketdw.etl.store.RunLedger;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Run ledger on {@code meta_etl_run_log}. Each call uses its own autocommit connection.
 */
public final class RunLogDao implements RunLedger {
    private final Database database;

    public RunLogDao(Database database) {
        this.database = database;
    }

    @Override
    public long start(String streamName, RunType runType) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            RunLogInsertParam row = RunLogInsertParam.builder()
                    .streamName(streamName)
                    .runType(runType.label())
                    .build();
            session.getMapper(RunLogMapper.class).insertRun(row);
            if (row.getId() == null) {
                throw new SQLException("failed to create run log row for " + streamName);
            }
            return row.getId();
        }
    }

    @Override
    public void finish(long runId, RunStatus status, String errMsg, int requestCount, int failCount) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(RunLogMapper.class).finishRun(RunLogFinishParam.builder()
                    .id(runId)
                    .status(status.name())
                    .errMsg(errMsg)
                    .requestCount(requestCount)
                    .failCount(failCount)
                    .build());
        }
    }

    @Override
    public List<RunLogRecord> listRecent(int limit) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toRecords(session.getMapper(RunLogMapper.class).selectRecent(Math.max(1, limit)));
        }
    }

    @Override
    public List<RunLogRecord> listRunning() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toRecords(session.getMapper(RunLogMapper.class).selectRunning());
        }
    }

    @Override
    public int markAbandoned(long runId, String errMsg, Instant endAt) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(RunLogMapper.class).markAbandoned(runId, errMsg, OffsetDateTime.ofInstant(endAt, ZoneOffset.UTC));
        }
    }

    private static List<RunLogRecord> toRecords(List<RunLogRow> rows) {
        List<RunLogRecord> out = new ArrayList<>();
        for (RunLogRow row : rows) {
            out.add(new RunLogRecord(
                    row.getId(),
                    row.getStreamName(),
                    "full".equalsIgnoreCase(row.getRunType()) ? RunType.FULL : RunType.INCREMENTAL,
                    row.getStartAt() == null ? null : row.getStartAt().toInstant(),
                    row.getEndAt() == null ? null : row.getEndAt().toInstant(),
                    RunStatus.fromText(row.getStatus()),
                    row.getErrMsg(),
                    row.getRequestCount(),
                    row.getFailCount()
            ));
        }
        return out;
    }
}
