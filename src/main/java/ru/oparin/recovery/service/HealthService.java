package ru.oparin.recovery.service;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.config.properties.StoreProperties;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Service
public class HealthService {

    private final DatabaseClient databaseClient;
    private final StoreProperties storeProperties;
    private final Clock clock;

    public HealthService(DatabaseClient databaseClient, StoreProperties storeProperties, Clock clock) {
        this.databaseClient = databaseClient;
        this.storeProperties = storeProperties;
        this.clock = clock;
    }

    public Map<String, Object> getBasicHealth() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", LocalDateTime.now(clock));
        health.put("service", "recovery");
        health.put("version", "1.0.0");
        return health;
    }

    /**
     * Проверка хранилища токенов: оно общее для web-сервиса и воркера.
     */
    public Mono<Map<String, Object>> getDatabaseHealth() {
        Map<String, Object> health = new HashMap<>();

        return databaseClient.sql("SELECT COUNT(*) AS pending FROM recovery.reset_tokens WHERE state = 'PENDING'")
                .fetch()
                .first()
                .timeout(storeProperties.getStatementTimeout())
                .map(result -> {
                    health.put("status", "CONNECTED");
                    health.put("isValid", true);
                    health.put("pendingTokens", result.get("pending"));
                    return health;
                })
                .onErrorResume(e -> {
                    health.put("status", "ERROR");
                    health.put("error", String.valueOf(e.getMessage()));
                    return Mono.just(health);
                });
    }
}
