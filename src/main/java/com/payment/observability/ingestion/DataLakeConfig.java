package com.payment.observability.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Connection to the data lake holding raw provider events. The pool is not registered as a
 * {@code DataSource} bean so the application's own datasource stays auto-configured; it connects
 * lazily on first use.
 */
@Slf4j
@Configuration
public class DataLakeConfig {

    @Value("${payment.datalake.url:jdbc:postgresql://localhost:5432/datalake}")
    private String url;

    @Value("${payment.datalake.username:postgres}")
    private String username;

    @Value("${payment.datalake.password:postgres}")
    private String password;

    @Value("${payment.datalake.pool-size:5}")
    private int poolSize;

    private HikariDataSource dataSource;

    @Bean
    public DataLakeClient dataLakeClient(ObjectMapper objectMapper) {
        dataSource = new HikariDataSource();
        dataSource.setPoolName("datalake");
        dataSource.setJdbcUrl(url);
        dataSource.setUsername(username);
        dataSource.setPassword(password);
        dataSource.setMaximumPoolSize(poolSize);
        dataSource.setInitializationFailTimeout(-1);
        log.info("Data lake datasource configured url={} poolSize={}", url, poolSize);
        return new DataLakeClient(new NamedParameterJdbcTemplate(dataSource), objectMapper);
    }

    @PreDestroy
    public void close() {
        if (dataSource != null) {
            dataSource.close();
        }
    }
}
