package ru.oparin.recovery.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Настройки фоновой очистки токенов. Префикс app.cleanup.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.cleanup")
public class CleanupProperties {

    private boolean enabled = false;

    /**
     * Период перевода просроченных токенов в EXPIRED.
     */
    private long sweepIntervalMs = 60_000;

    /**
     * Сколько хранить закрытые токены (аудит) перед удалением.
     */
    private Duration retention = Duration.ofDays(7);
}
