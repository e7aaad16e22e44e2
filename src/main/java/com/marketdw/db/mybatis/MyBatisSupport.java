package com.marketdw.db.mybatis;

import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;

/**
 * Process-wide MyBatis factory; sessions run on connections the caller owns.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);

        config.addMapper(WatermarkMapper.class);
        config.addMapper(RunLogMapper.class);
        config.addMapper(RetryGuardMapper.class);
        config.addMapper(TradeCalendarMapper.class);
        config.addMapper(TableStatsMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
