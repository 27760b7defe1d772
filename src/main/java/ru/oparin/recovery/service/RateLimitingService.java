package ru.oparin.recovery.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.config.properties.ResetProperties;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ограничение частоты запросов на сброс пароля с одного клиента (IP или Telegram чат).
 * Счетчики живут в памяти процесса: это защита от перебора, а не инвариант хранилища.
 */
@Slf4j
@Service
public class RateLimitingService {

    // ключ: клиент, значение: количество запросов за последний час
    private final Cache<String, AtomicInteger> hourlyRequests = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(1))
            .maximumSize(10_000)
            .build();

    private final ResetProperties resetProperties;

    public RateLimitingService(ResetProperties resetProperties) {
        this.resetProperties = resetProperties;
    }

    /**
     * Учесть запрос клиента и проверить, не превышен ли лимит.
     *
     * @param clientKey ключ клиента, например "ip:10.0.0.1" или "tg:12345"
     * @return true, если запрос разрешен
     */
    public Mono<Boolean> tryAcquire(String clientKey) {
        return Mono.fromCallable(() -> {
            AtomicInteger counter = hourlyRequests.get(clientKey, key -> new AtomicInteger(0));
            int current = counter.incrementAndGet();
            int limit = resetProperties.getRateLimitPerHour();

            if (current > limit) {
                log.warn("Превышен лимит запросов на сброс пароля для {}: {}/{}", clientKey, current, limit);
                return false;
            }
            return true;
        });
    }
}
