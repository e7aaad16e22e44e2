package com.marketdw.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/marketdw";
    private String user = "marketdw";
    private String pass = "marketdw";
    private String schema = "marketdw";
    private SqlLog sqlLog = new SqlLog();

    @Getter
    @Setter
    public static class SqlLog {
        private boolean enabled = false;
    }
}
