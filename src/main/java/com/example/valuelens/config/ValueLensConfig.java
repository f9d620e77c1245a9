package com.example.valuelens.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ValueLensProperties.class)
public class ValueLensConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
