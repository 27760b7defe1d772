package ru.oparin.recovery.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.UUID;

/**
 * Настройки воркера доставки ссылок. Префикс app.delivery.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.delivery")
public class DeliveryProperties {

    /**
     * Включен ли опрос очереди доставки в этом процессе.
     */
    private boolean enabled = false;

    /**
     * Пауза между циклами опроса.
     */
    private long pollIntervalMs = 3000;

    /**
     * Сколько токенов забирать за один цикл.
     */
    private int batchSize = 20;

    /**
     * Максимальное число попыток отправки одного токена.
     */
    private int maxAttempts = 5;

    /**
     * На сколько воркер захватывает токен. По истечении захват может забрать другой экземпляр.
     * Должен быть больше sendTimeout: если отправка переживет захват, второй воркер отправит ссылку повторно.
     */
    private Duration claimTimeout = Duration.ofMinutes(2);

    /**
     * Предельное время одной отправки через канал. Telegram ограничен 15 секундами,
     * SMTP в худшем случае 30 секундами (connect + write + read по 10 секунд).
     */
    private Duration sendTimeout = Duration.ofSeconds(45);

    /**
     * Идентификатор экземпляра воркера. Должен различаться у параллельно работающих воркеров.
     */
    private String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    /**
     * Время отправки, которое гарантированно укладывается в захват.
     * Если sendTimeout настроен не меньше claimTimeout, берется половина захвата.
     */
    public Duration effectiveSendTimeout() {
        return sendTimeout.compareTo(claimTimeout) < 0 ? sendTimeout : claimTimeout.dividedBy(2);
    }
}
