package com.ledger.anomaly.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledger.anomaly.datasource.GLDataSource;
import com.ledger.anomaly.datasource.JsonFileGLDataSource;
import com.ledger.anomaly.engine.IdGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdGenerator idGenerator() {
        return IdGenerator.uuid("GLAD");
    }

    @Bean
    @ConditionalOnMissingBean(GLDataSource.class)
    public GLDataSource jsonFileGLDataSource(ObjectMapper objectMapper,
                                             ResourceLoader resourceLoader,
                                             DataSourceProperties properties) {
        return new JsonFileGLDataSource(objectMapper, resourceLoader.getResource(properties.getLocation()));
    }
}
