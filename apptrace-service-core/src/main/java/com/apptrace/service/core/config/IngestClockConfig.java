package com.apptrace.service.core.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Clock the decoder falls back to for log entries that carry neither a time nor an observed time. */
@Configuration
public class IngestClockConfig {

    @Bean
    public Clock ingestClock() {
        return Clock.systemUTC();
    }
}
