package ru.oparin.recovery.service.telegram;

import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.time.Duration;

/**
 * Telegram бот восстановления пароля на long polling.
 * Обновления обрабатываются последовательно в потоке сессии telegrambots.
 */
@Slf4j
public class ResetTelegramBot extends TelegramLongPollingBot {

    private static final Duration UPDATE_TIMEOUT = Duration.ofSeconds(30);

    private final String botUsername;
    private final ResetBotService resetBotService;

    public ResetTelegramBot(String botToken, String botUsername, ResetBotService resetBotService) {
        super(botToken);
        this.botUsername = botUsername;
        this.resetBotService = resetBotService;
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        try {
            resetBotService.processUpdate(update).block(UPDATE_TIMEOUT);
        } catch (Exception e) {
            log.error("Ошибка обработки обновления {} от Telegram", update.getUpdateId(), e);
        }
    }
}
