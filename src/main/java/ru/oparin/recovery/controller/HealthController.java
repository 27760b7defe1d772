package ru.oparin.recovery.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.service.HealthService;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> healthCheck() {
        return Mono.just(ResponseEntity.ok(healthService.getBasicHealth()));
    }

    @GetMapping("/database")
    public Mono<ResponseEntity<Map<String, Object>>> databaseHealth() {
        return healthService.getDatabaseHealth()
                .map(dbHealth -> {
                    if ("ERROR".equals(dbHealth.get("status"))) {
                        log.warn("Хранилище токенов недоступно: {}", dbHealth.get("error"));
                        return ResponseEntity.status(503).body(dbHealth);
                    }
                    return ResponseEntity.ok(dbHealth);
                });
    }
}
