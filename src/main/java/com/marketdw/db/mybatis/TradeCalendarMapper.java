package com.marketdw.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface TradeCalendarMapper {
    @Select("SELECT DISTINCT cal_date FROM dim_trade_cal " +
            "WHERE exchange=#{exchange} AND is_open=1 AND cal_date BETWEEN #{lower} AND #{upper} ORDER BY cal_date")
    List<Integer> selectOpenDates(@Param("exchange") String exchange, @Param("lower") int lower, @Param("upper") int upper);

    @Select("SELECT MAX(cal_date) FROM dim_trade_cal WHERE exchange=#{exchange} AND is_open=1 AND cal_date <= #{onOrBefore}")
    Integer selectLatestOpenDate(@Param("exchange") String exchange, @Param("onOrBefore") int onOrBefore);

    @Select("SELECT MIN(cal_date) FROM dim_trade_cal WHERE exchange=#{exchange} AND is_open=1 AND cal_date > #{after}")
    Integer selectNextOpenDate(@Param("exchange") String exchange, @Param("after") int after);
}
