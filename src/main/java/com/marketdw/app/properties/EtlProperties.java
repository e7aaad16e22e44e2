package com.marketdw.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "etl")
public class EtlProperties {
    /**
     * First trade date (yyyyMMdd) loaded when no explicit start is given.
     */
    private int startDate = 20100101;
    private Source source = new Source();
    private Runner runner = new Runner();
    private Guard guard = new Guard();
    private Reaper reaper = new Reaper();
    private Calendar calendar = new Calendar();

    @Getter
    @Setter
    public static class Source {
        private String baseUrl = "http://api.tushare.pro";
        private String token = "";
        private int rateLimitPerMinute = 500;
        private int timeoutSec = 30;
        private int maxAttempts = 3;
        private long backoffBaseMs = 1000L;
    }

    @Getter
    @Setter
    public static class Runner {
        /**
         * Range-capable layers switch to one batch call above this many pending units; 0 disables batching.
         */
        private int batchThreshold = 30;
    }

    @Getter
    @Setter
    public static class Guard {
        private int retries = 2;
        private int retryDelaySec = 120;
        private int timeoutSec = 3600;
    }

    @Getter
    @Setter
    public static class Reaper {
        private int thresholdMinutes = 120;
    }

    @Getter
    @Setter
    public static class Calendar {
        private String exchange = "SSE";
        private String zone = "Asia/Shanghai";
    }
}
