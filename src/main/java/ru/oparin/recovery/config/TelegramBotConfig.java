package ru.oparin.recovery.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;
import ru.oparin.recovery.service.telegram.ResetBotService;
import ru.oparin.recovery.service.telegram.ResetTelegramBot;

/**
 * Конфигурация для Telegram бота.
 * Регистрирует бота на long polling, только если задан токен и включен {@code telegram.bot.polling-enabled}.
 */
@Configuration
@Slf4j
@ConditionalOnExpression("${telegram.bot.polling-enabled:false} and '${telegram.bot.token:}' != ''")
public class TelegramBotConfig {

    @Bean
    public ResetTelegramBot resetTelegramBot(@Value("${telegram.bot.token}") String botToken,
                                             @Value("${telegram.bot.username}") String botUsername,
                                             ResetBotService resetBotService) {
        return new ResetTelegramBot(botToken, botUsername, resetBotService);
    }

    @Bean
    public TelegramBotsApi telegramBotsApi(ResetTelegramBot resetTelegramBot) {
        try {
            TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
            botsApi.registerBot(resetTelegramBot);
            log.info("Telegram бот @{} зарегистрирован на long polling", resetTelegramBot.getBotUsername());
            return botsApi;
        } catch (TelegramApiException e) {
            throw new RuntimeException("Не удалось инициализировать TelegramBotsApi", e);
        }
    }
}
