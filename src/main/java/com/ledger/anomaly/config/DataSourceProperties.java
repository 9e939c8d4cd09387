package com.ledger.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "gl.data-source")
public class DataSourceProperties {

    // Spring resource location of a JSON array of line items (classpath:, file:, ...)
    private String location = "classpath:ledger/line-items.json";
}
