package com.openforge.toolbridge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.toolbridge.agent.AgentProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - agentTurnExecutor  → fixed pool that runs turns; the HTTP thread only waits with a timeout
 *  - Java HttpClient    → the only HTTP engine, shared by the model client and the adapters
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - Clock              → session idle tracking
 */
@Configuration
public class AppConfig {

    /**
     * Named "agentTurnExecutor"; being an Executor it also stands in for Spring
     * Boot's auto-configured applicationTaskExecutor.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentTurnExecutor(AgentProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread t = new Thread(runnable, "agent-turn-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(properties.turnWorkers(), threads);
    }

    /**
     * Single, shared HttpClient instance. Connect timeout only; read timeouts
     * are set per request by the model client and the adapters.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper, also used by Spring MVC:
     *  - snake_case property names (finish_reason, error_type …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
