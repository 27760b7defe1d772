package ru.oparin.recovery.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.config.EnableR2dbcAuditing;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import ru.oparin.recovery.exception.StoreUnavailableException;

import java.time.Duration;

@Configuration
@EnableR2dbcAuditing
public class DatabaseConfig {

    @Autowired
    private ConnectionFactory connectionFactory;

    @Bean
    public DatabaseClient databaseClient() {
        return DatabaseClient.create(connectionFactory);
    }

    @Bean
    public R2dbcEntityTemplate r2dbcEntityTemplate() {
        return new R2dbcEntityTemplate(connectionFactory);
    }

    /**
     * Обертка для Mono с retry логикой при недоступности хранилища.
     * Повторяются только операции, которые безопасно выполнить еще раз: выпуск токена и чтение.
     * Погашение токена через нее не оборачивается.
     */
    public static <T> Mono<T> withRetry(Mono<T> mono) {
        return mono.retryWhen(Retry.backoff(3, Duration.ofSeconds(1))
                .maxBackoff(Duration.ofSeconds(5))
                .jitter(0.1)
                .filter(StoreUnavailableException.class::isInstance)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }
}
