package com.marketdw.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.List;

public interface RunLogMapper {
    @Insert("INSERT INTO meta_etl_run_log(stream_name, run_type, start_at, status) VALUES(#{streamName}, #{runType}, now(), 'RUNNING')")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertRun(RunLogInsertParam row);

    @Update("UPDATE meta_etl_run_log SET end_at=now(), status=#{status}, err_msg=#{errMsg}, " +
            "request_count=#{requestCount}, fail_count=#{failCount} " +
            "WHERE id=#{id} AND status='RUNNING'")
    int finishRun(RunLogFinishParam row);

    @Select("SELECT id, stream_name, run_type, start_at, end_at, status, err_msg, request_count, fail_count " +
            "FROM meta_etl_run_log ORDER BY id DESC LIMIT #{limit}")
    List<RunLogRow> selectRecent(@Param("limit") int limit);

    @Select("SELECT id, stream_name, run_type, start_at, end_at, status, err_msg, request_count, fail_count " +
            "FROM meta_etl_run_log WHERE status='RUNNING' ORDER BY start_at ASC")
    List<RunLogRow> selectRunning();

    @Update("UPDATE meta_etl_run_log SET status='FAILED', err_msg=#{errMsg}, end_at=COALESCE(end_at, #{endAt}) " +
            "WHERE id=#{id} AND status='RUNNING'")
    int markAbandoned(@Param("id") long id, @Param("errMsg") String errMsg, @Param("endAt") OffsetDateTime endAt);
}
