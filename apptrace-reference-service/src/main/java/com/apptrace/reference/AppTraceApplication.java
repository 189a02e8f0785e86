package com.apptrace.reference;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Collector that wires the OTLP and query endpoints to the configured storage. The storage module
 * builds its own pool, so Boot's DataSource auto-configuration stays off.
 */
@SpringBootApplication(scanBasePackages = {"com.apptrace"}, exclude = DataSourceAutoConfiguration.class)
public class AppTraceApplication {
    public static void main(String[] args) {
        SpringApplication.run(AppTraceApplication.class, args);
    }
}
