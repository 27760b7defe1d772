package ru.oparin.recovery.service.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.oparin.recovery.config.properties.ResetProperties;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Построение ссылки и текстов сообщений со ссылкой для сброса пароля.
 */
@Component
@RequiredArgsConstructor
public class ResetMessageBuilder {

    private final ResetProperties resetProperties;

    public String buildResetLink(String token) {
        String base = resetProperties.getFrontendUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + resetProperties.getResetPath() + "?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }

    public String buildTelegramMessage(String resetLink) {
        return String.format("""
                🔐 Восстановление пароля

                Кто-то (надеемся, вы) запросил сброс пароля для вашего аккаунта.
                Чтобы задать новый пароль, откройте ссылку:

                %s

                Ссылка одноразовая и действует %d минут.
                Если вы не запрашивали сброс, просто проигнорируйте это сообщение.
                """, resetLink, getTtlMinutes());
    }

    public String buildEmailSubject() {
        return "Восстановление пароля";
    }

    public String buildEmailContent(String resetLink) {
        return String.format("""
                Здравствуйте!

                Для вашего аккаунта был запрошен сброс пароля.

                Для установки нового пароля перейдите по ссылке:
                %s

                Ссылка одноразовая и действительна в течение %d минут.

                Если вы не запрашивали восстановление пароля, просто проигнорируйте это письмо.
                """, resetLink, getTtlMinutes());
    }

    private long getTtlMinutes() {
        return resetProperties.getTokenTtl().toMinutes();
    }
}
