package ru.oparin.recovery.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Настройки работы с хранилищем токенов. Префикс app.store.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.store")
public class StoreProperties {

    /**
     * Верхняя граница времени одной операции с базой.
     */
    private Duration statementTimeout = Duration.ofSeconds(5);
}
