package com.ledger.anomaly.runner;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot batch run settings, bound from {@code gl.run.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "gl.run")
public class RunProperties {

    private boolean enabled = false;
    private String tenantId = "default";
    private String fiscalYear;
    private String fiscalPeriod;
    private List<String> glAccounts = new ArrayList<>();

    // Number of flagged accounts, highest anomaly count first, to build risk profiles for
    private int profileTopAccounts = 5;

    // Optional path the full result is written to as JSON
    private String outputFile;
}
