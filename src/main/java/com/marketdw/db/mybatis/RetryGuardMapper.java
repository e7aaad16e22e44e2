package com.marketdw.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.List;

public interface RetryGuardMapper {
    @Select("SELECT id, task_name, idempotency_key, status, attempt, started_at, finished_at, timeout_sec, err_msg " +
            "FROM meta_etl_retry_guard WHERE task_name=#{taskName} AND idempotency_key=#{idempotencyKey}")
    RetryGuardRow select(@Param("taskName") String taskName, @Param("idempotencyKey") String idempotencyKey);

    @Insert("INSERT INTO meta_etl_retry_guard(task_name, idempotency_key, status, attempt, started_at, finished_at, timeout_sec, err_msg, updated_at) " +
            "VALUES(#{taskName}, #{idempotencyKey}, 'RUNNING', #{attempt}, now(), NULL, #{timeoutSec}, #{errMsg}, now()) " +
            "ON CONFLICT(task_name, idempotency_key) DO UPDATE SET status=excluded.status, attempt=excluded.attempt, " +
            "started_at=excluded.started_at, finished_at=NULL, timeout_sec=excluded.timeout_sec, " +
            "err_msg=excluded.err_msg, updated_at=excluded.updated_at")
    int upsertRunning(RetryGuardUpsertParam row);

    @Insert("INSERT INTO meta_etl_retry_guard(task_name, idempotency_key, status, attempt, started_at, finished_at, timeout_sec, err_msg, updated_at) " +
            "VALUES(#{taskName}, #{idempotencyKey}, #{status}, #{attempt}, NULL, now(), #{timeoutSec}, #{errMsg}, now()) " +
            "ON CONFLICT(task_name, idempotency_key) DO UPDATE SET status=excluded.status, attempt=excluded.attempt, " +
            "finished_at=excluded.finished_at, timeout_sec=excluded.timeout_sec, " +
            "err_msg=excluded.err_msg, updated_at=excluded.updated_at")
    int upsertFinished(RetryGuardUpsertParam row);

    @Select("SELECT id, task_name, idempotency_key, status, attempt, started_at, finished_at, timeout_sec, err_msg " +
            "FROM meta_etl_retry_guard WHERE status='RUNNING' ORDER BY started_at ASC")
    List<RetryGuardRow> selectRunning();

    @Update("UPDATE meta_etl_retry_guard SET status='FAILED', err_msg=#{errMsg}, " +
            "finished_at=COALESCE(finished_at, #{finishedAt}), updated_at=now() " +
            "WHERE id=#{id} AND status='RUNNING'")
    int markAbandoned(@Param("id") long id, @Param("errMsg") String errMsg, @Param("finishedAt") OffsetDateTime finishedAt);
}
