package com.example.valuelens.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Pool for upstream provider calls. Quote and financials fetches for one symbol run here side by side.
 *
 * With the default queue capacity of 0 the pool hands each task straight to a thread, growing to the
 * maximum size; a rejected task is run by the caller (see {@code StockResolutionService}).
 */
@Configuration
public class AsyncConfig {

    public static final String PROVIDER_EXECUTOR = "provider-executor";

    @Bean(name = PROVIDER_EXECUTOR)
    public Executor providerExecutor(ValueLensProperties properties) {
        ValueLensProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(settings.getCorePoolSize());
        e.setMaxPoolSize(settings.getMaxPoolSize());
        e.setQueueCapacity(settings.getQueueCapacity());
        e.setThreadNamePrefix("provider-");
        e.initialize();
        return e;
    }
}
