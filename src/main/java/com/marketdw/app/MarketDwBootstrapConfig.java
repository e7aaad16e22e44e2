package com.marketdw.app;

import com.marketdw.app.properties.DbProperties;
import com.marketdw.app.properties.EtlProperties;
import com.marketdw.db.Database;
import com.marketdw.db.JdbcPipelineStore;
import com.marketdw.db.MigrationRunner;
import com.marketdw.db.RetryGuardDao;
import com.marketdw.db.RunLogDao;
import com.marketdw.db.TableStatsDao;
import com.marketdw.db.TradeCalendarDao;
import com.marketdw.etl.calendar.UnitSequencer;
import com.marketdw.etl.guard.IdempotencyGuard;
import com.marketdw.etl.guard.ZombieReaper;
import com.marketdw.etl.health.HealthAuditor;
import com.marketdw.etl.health.LayerRegistry;
import com.marketdw.etl.layer.BaseLayerJob;
import com.marketdw.etl.layer.Layers;
import com.marketdw.etl.runner.LayerRunner;
import com.marketdw.etl.source.RateLimiter;
import com.marketdw.etl.source.RetryingSource;
import com.marketdw.etl.source.TushareClient;
import com.marketdw.utils.Sleeper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Builds every component once from the bound properties. Environment overrides are read here and nowhere else.
 */
@Configuration
@EnableConfigurationProperties({DbProperties.class, EtlProperties.class})
public class MarketDwBootstrapConfig {

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                firstNonBlank(System.getenv("MARKETDW_DB_URL"), dbProperties.getUrl()),
                firstNonBlank(System.getenv("MARKETDW_DB_USER"), dbProperties.getUser()),
                firstNonBlank(System.getenv("MARKETDW_DB_PASS"), dbProperties.getPass()),
                firstNonBlank(dbProperties.getSchema(), "marketdw"),
                dbProperties.getSqlLog() != null && dbProperties.getSqlLog().isEnabled()
        );
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    public Clock tradeClock(EtlProperties etl) {
        return Clock.system(ZoneId.of(firstNonBlank(etl.getCalendar().getZone(), "Asia/Shanghai")));
    }

    @Bean
    @Lazy
    public JdbcPipelineStore pipelineStore(Database database) {
        return new JdbcPipelineStore(database);
    }

    @Bean
    @Lazy
    public RunLogDao runLogDao(Database database) {
        return new RunLogDao(database);
    }

    @Bean
    @Lazy
    public RetryGuardDao retryGuardDao(Database database) {
        return new RetryGuardDao(database);
    }

    @Bean
    @Lazy
    public UnitSequencer unitSequencer(Database database, EtlProperties etl, Clock tradeClock) {
        return new UnitSequencer(new TradeCalendarDao(database, etl.getCalendar().getExchange()), tradeClock);
    }

    @Bean
    @Lazy
    public RetryingSource marketDataSource(EtlProperties etl) {
        EtlProperties.Source source = etl.getSource();
        TushareClient client = new TushareClient(
                source.getBaseUrl(),
                firstNonBlank(System.getenv("MARKETDW_SOURCE_TOKEN"), source.getToken()),
                source.getTimeoutSec()
        );
        return new RetryingSource(
                client,
                new RateLimiter(source.getRateLimitPerMinute()),
                source.getMaxAttempts(),
                source.getBackoffBaseMs(),
                Sleeper.SYSTEM
        );
    }

    @Bean
    @Lazy
    public BaseLayerJob baseLayerJob(RetryingSource marketDataSource, JdbcPipelineStore pipelineStore,
                                     RunLogDao runLogDao, UnitSequencer unitSequencer) {
        return new BaseLayerJob(marketDataSource, marketDataSource, pipelineStore, runLogDao, unitSequencer);
    }

    @Bean
    @Lazy
    public LayerRunner odsRunner(RetryingSource marketDataSource, JdbcPipelineStore pipelineStore,
                                 RunLogDao runLogDao, UnitSequencer unitSequencer, EtlProperties etl) {
        return new LayerRunner(Layers.ods(marketDataSource, marketDataSource), pipelineStore, runLogDao, unitSequencer,
                etl.getRunner().getBatchThreshold(), true);
    }

    @Bean
    @Lazy
    public LayerRunner dwdRunner(JdbcPipelineStore pipelineStore, RunLogDao runLogDao,
                                 UnitSequencer unitSequencer, EtlProperties etl) {
        return new LayerRunner(Layers.dwd(), pipelineStore, runLogDao, unitSequencer,
                etl.getRunner().getBatchThreshold(), true);
    }

    @Bean
    @Lazy
    public HealthAuditor healthAuditor(Database database, JdbcPipelineStore pipelineStore, UnitSequencer unitSequencer) {
        return new HealthAuditor(new TableStatsDao(database), pipelineStore, unitSequencer, LayerRegistry.defaults());
    }

    @Bean
    @Lazy
    public IdempotencyGuard idempotencyGuard(RetryGuardDao retryGuardDao) {
        return new IdempotencyGuard(retryGuardDao, Sleeper.SYSTEM);
    }

    @Bean
    @Lazy
    public ZombieReaper zombieReaper(RunLogDao runLogDao, RetryGuardDao retryGuardDao) {
        return new ZombieReaper(runLogDao, retryGuardDao, Clock.systemUTC());
    }

    @Bean
    @Lazy
    public DailyPipeline dailyPipeline(BaseLayerJob baseLayerJob,
                                       @Qualifier("odsRunner") LayerRunner odsRunner,
                                       @Qualifier("dwdRunner") LayerRunner dwdRunner,
                                       HealthAuditor healthAuditor, EtlProperties etl) {
        return new DailyPipeline(baseLayerJob, odsRunner, dwdRunner, healthAuditor, etl.getStartDate());
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
