package com.marketdw.db;

import com.marketdw.db.mybatis.MyBatisSupport;
import com.marketdw.db.mybatis.TradeCalendarMapper;
import com.marketdw.etl.calendar.TradeCalendar;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Open dates of one exchange from {@code dim_trade_cal}.
 */
public final class TradeCalendarDao implements TradeCalendar {
    private final Database database;
    private final String exchange;

    public TradeCalendarDao(Database database, String exchange) {
        this.database = database;
        this.exchange = exchange == null || exchange.trim().isEmpty() ? "SSE" : exchange.trim();
    }

    @Override
    public List<Integer> listOpenDates(int lower, int upper) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(TradeCalendarMapper.class).selectOpenDates(exchange, lower, upper);
        }
    }

    @Override
    public Optional<Integer> latestOpenDate(int onOrBefore) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(TradeCalendarMapper.class).selectLatestOpenDate(exchange, onOrBefore));
        }
    }

    @Override
    public Optional<Integer> nextOpenDate(int after) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(TradeCalendarMapper.class).selectNextOpenDate(exchange, after));
        }
    }
}
