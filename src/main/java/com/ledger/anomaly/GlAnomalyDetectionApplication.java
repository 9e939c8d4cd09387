package com.ledger.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GlAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlAnomalyDetectionApplication.class, args);
    }
}
