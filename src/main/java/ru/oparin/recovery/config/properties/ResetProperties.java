package ru.oparin.recovery.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import ru.oparin.recovery.model.enums.DeliveryChannel;

import java.time.Duration;

/**
 * Настройки выпуска и погашения токенов сброса пароля.
 * Загружаются из application.yml с префиксом app.reset.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.reset")
public class ResetProperties {

    /**
     * Время жизни токена.
     */
    private Duration tokenTtl = Duration.ofMinutes(30);

    /**
     * Количество случайных байт в токене (не меньше 16, т.е. 128 бит).
     */
    private int tokenBytes = 32;

    /**
     * Минимальное время ответа на запрос сброса, одинаковое для существующих и несуществующих аккаунтов.
     */
    private Duration minResponseTime = Duration.ofMillis(400);

    /**
     * Публичный адрес фронтенда, на котором открывается форма нового пароля.
     */
    private String frontendUrl = "http://localhost:8080";

    /**
     * Путь страницы сброса пароля.
     */
    private String resetPath = "/reset-password";

    /**
     * Сколько раз повторять выпуск токена при конфликте с параллельным выпуском для того же аккаунта.
     */
    private int issueAttempts = 3;

    /**
     * Предпочитаемый канал доставки. Если у аккаунта нет адреса в этом канале, используется email.
     */
    private DeliveryChannel preferredChannel = DeliveryChannel.TELEGRAM;

    /**
     * Сколько запросов на сброс допускается с одного клиента (IP или чата) за час.
     */
    private int rateLimitPerHour = 5;
}
