package ru.oparin.recovery.service.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.model.enums.DeliveryChannel;
import ru.oparin.recovery.model.enums.DeliveryResult;
import ru.oparin.recovery.service.telegram.TelegramMessageService;

/**
 * Доставка ссылки сообщением от Telegram бота в привязанный чат.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "telegram.bot.token")
public class TelegramNotificationChannel implements NotificationChannel {

    private final TelegramMessageService telegramMessageService;
    private final ResetMessageBuilder messageBuilder;

    @Override
    public DeliveryChannel getChannel() {
        return DeliveryChannel.TELEGRAM;
    }

    @Override
    public Mono<DeliveryResult> send(String contact, String resetLink) {
        Long chatId;
        try {
            chatId = Long.valueOf(contact);
        } catch (NumberFormatException e) {
            log.error("Некорректный chat id для доставки в Telegram: {}", contact);
            return Mono.just(DeliveryResult.PERMANENT_FAILURE);
        }

        return telegramMessageService.sendPlainMessage(chatId, messageBuilder.buildTelegramMessage(resetLink));
    }
}
