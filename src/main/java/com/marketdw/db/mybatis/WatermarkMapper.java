package com.marketdw.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface WatermarkMapper {
    @Select("SELECT stream_name, water_mark, status, last_run_at, last_err FROM meta_etl_watermark WHERE stream_name = #{streamName}")
    WatermarkRow selectByStream(@Param("streamName") String streamName);

    @Insert("INSERT INTO meta_etl_watermark(stream_name, water_mark, status, last_run_at, last_err) " +
            "VALUES(#{streamName}, #{waterMark}, 'SUCCESS', now(), NULL) " +
            "ON CONFLICT(stream_name) DO NOTHING")
    int insertIfAbsent(@Param("streamName") String streamName, @Param("waterMark") int waterMark);

    @Insert("INSERT INTO meta_etl_watermark(stream_name, water_mark, status, last_run_at, last_err) " +
            "VALUES(#{streamName}, #{waterMark}, #{status}, now(), #{lastErr}) " +
            "ON CONFLICT(stream_name) DO UPDATE SET water_mark=excluded.water_mark, status=excluded.status, " +
            "last_run_at=excluded.last_run_at, last_err=excluded.last_err")
    int upsert(WatermarkUpsertParam row);

    @Select("SELECT stream_name, water_mark, status, last_run_at, last_err FROM meta_etl_watermark ORDER BY stream_name")
    List<WatermarkRow> selectAll();
}
