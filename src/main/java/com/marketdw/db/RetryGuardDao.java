package com.marketdw.db;

import com.marketdw.db.mybatis.MyBatisSupport;
import com.marketdw.db.mybatis.RetryGuardMapper;
import com.marketdw.db.mybatis.RetryGuardRow;
import com.marketdw.db.mybatis.RetryGuardUpsertParam;
import com.marketdw.etl.model.GuardRecord;
import com.marketdw.etl.model.RunStatus;
import com.marketdw.etl.store.GuardStore;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class RetryGuardDao implements GuardStore {
    private final Database database;

    public RetryGuardDao(Database database) {
        this.database = database;
    }

    @Override
    public Optional<GuardRecord> find(String taskName, String idempotencyKey) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            RetryGuardRow row = session.getMapper(RetryGuardMapper.class).select(taskName, idempotencyKey);
            return Optional.ofNullable(row).map(RetryGuardDao::toRecord);
        }
    }

    @Override
    public void upsert(String taskName, String idempotencyKey, RunStatus status, int attempt, int timeoutSec, String errMsg)
            throws SQLException {
        RetryGuardUpsertParam row = RetryGuardUpsertParam.builder()
                .taskName(taskName)
                .idempotencyKey(idempotencyKey)
                .status(status.name())
                .attempt(attempt)
                .timeoutSec(timeoutSec)
                .errMsg(errMsg)
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            RetryGuardMapper mapper = session.getMapper(RetryGuardMapper.class);
            if (status == RunStatus.RUNNING) {
                mapper.upsertRunning(row);
            } else {
                mapper.upsertFinished(row);
            }
        }
    }

    @Override
    public List<GuardRecord> listRunning() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<GuardRecord> out = new ArrayList<>();
            for (RetryGuardRow row : session.getMapper(RetryGuardMapper.class).selectRunning()) {
                out.add(toRecord(row));
            }
            return out;
        }
    }

    @Override
    public int markAbandoned(long id, String errMsg, Instant finishedAt) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(RetryGuardMapper.class)
                    .markAbandoned(id, errMsg, OffsetDateTime.ofInstant(finishedAt, ZoneOffset.UTC));
        }
    }

    private static GuardRecord toRecord(RetryGuardRow row) {
        return new GuardRecord(
                row.getId(),
                row.getTaskName(),
                row.getIdempotencyKey(),
                RunStatus.fromText(row.getStatus()),
                row.getAttempt(),
                row.getStartedAt() == null ? null : row.getStartedAt().toInstant(),
                row.getFinishedAt() == null ? null : row.getFinishedAt().toInstant(),
                row.getTimeoutSec(),
                row.getErrMsg()
        );
    }
}
