package io.logscope.engine.config;

import com.clickhouse.jdbc.ClickHouseDataSource;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class ClickHouseConfig {

    /**
     * ClickHouse DataSource, only when app.clickhouse.enabled=true. An enabled store without
     * a JDBC url is a configuration error.
     */
    @Bean(name = "clickHouseDataSource")
    @ConditionalOnProperty(prefix = "app.clickhouse", name = "enabled", havingValue = "true")
    public DataSource clickHouseDataSource(@Value("${app.clickhouse.url:}") String url,
                                           @Value("${app.clickhouse.user:default}") String user,
                                           @Value("${app.clickhouse.password:}") String pass) {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("app.clickhouse.enabled=true but app.clickhouse.url is empty, "
                    + "expected jdbc:clickhouse://host:8123/db");
        }
        Properties props = new Properties();
        props.setProperty("user", user);
        props.setProperty("password", pass);
        try {
            return new ClickHouseDataSource(url, props);
        } catch (SQLException ex) {
            throw new IllegalStateException("Unable to initialise ClickHouse DataSource", ex);
        }
    }

    @Bean(name = "clickHouseJdbcTemplate")
    @ConditionalOnBean(name = "clickHouseDataSource")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource ds,
                                               @Value("${app.clickhouse.query-timeout:30s}") Duration queryTimeout) {
        JdbcTemplate template = new JdbcTemplate(ds);
        template.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        return template;
    }
}
