package ru.oparin.recovery.service.telegram;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.exception.RateLimitExceededException;
import ru.oparin.recovery.exception.StoreUnavailableException;
import ru.oparin.recovery.model.enums.ResetOrigin;
import ru.oparin.recovery.service.PasswordResetService;
import ru.oparin.recovery.util.EmailUtil;

import java.time.Duration;

/**
 * Диалог восстановления пароля в Telegram боте.
 * <p>
 * Бот только принимает email и запускает сброс. Ссылку доставляет воркер
 * по каналу, привязанному к аккаунту, а не в чат, из которого пришел запрос.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "telegram.bot.token")
public class ResetBotService {

    static final String RESET_CALLBACK = "reset";

    static final String WELCOME_MESSAGE = """
            👋 Здравствуйте!

            Я помогу восстановить доступ к аккаунту. Нажмите кнопку ниже или отправьте /reset, \
            затем укажите email, на который зарегистрирован аккаунт.""";
    static final String ASK_EMAIL_MESSAGE = "📧 Отправьте email, на который зарегистрирован аккаунт.\n\nДля отмены отправьте /cancel";
    static final String INVALID_EMAIL_MESSAGE = "❌ Это не похоже на email. Попробуйте еще раз или отправьте /cancel";
    static final String CANCELLED_MESSAGE = "Восстановление пароля отменено.";
    static final String UNAVAILABLE_MESSAGE = "⚠️ Сервис временно недоступен. Попробуйте позже.";
    static final String HELP_MESSAGE = "Отправьте /reset, чтобы восстановить пароль.";

    private static final String RESET_KEYBOARD = """
            {
                "inline_keyboard": [
                    [{"text": "🔑 Восстановить пароль", "callback_data": "reset"}]
                ]
            }""";

    private final PasswordResetService passwordResetService;
    private final TelegramMessageService telegramMessageService;

    // чаты, от которых ждем email после /reset
    private final Cache<Long, Boolean> awaitingEmail = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(10))
            .maximumSize(10_000)
            .build();

    public ResetBotService(PasswordResetService passwordResetService, TelegramMessageService telegramMessageService) {
        this.passwordResetService = passwordResetService;
        this.telegramMessageService = telegramMessageService;
    }

    /**
     * Обработать обновление от Telegram.
     */
    public Mono<Void> processUpdate(Update update) {
        if (update.hasCallbackQuery()) {
            return handleCallbackQuery(update.getCallbackQuery());
        }

        if (!update.hasMessage() || !update.getMessage().hasText()) {
            log.debug("Обновление не содержит текстового сообщения, пропускаем");
            return Mono.empty();
        }

        Message message = update.getMessage();
        Long chatId = message.getChatId();
        String text = message.getText().trim();

        if (text.startsWith("/start")) {
            return handleStartCommand(chatId);
        }
        if (text.startsWith("/reset")) {
            return handleResetCommand(chatId, text.substring("/reset".length()).trim());
        }
        if (text.startsWith("/cancel")) {
            return handleCancelCommand(chatId);
        }
        return handleTextMessage(chatId, text);
    }

    /**
     * Обработать команду /start.
     */
    public Mono<Void> handleStartCommand(Long chatId) {
        log.info("Обработка команды /start для чата {}", chatId);
        awaitingEmail.invalidate(chatId);
        return telegramMessageService.sendMessageWithKeyboard(chatId, WELCOME_MESSAGE, RESET_KEYBOARD);
    }

    /**
     * Обработать команду /reset. С аргументом ("/reset user@example.com") сразу запускает сброс.
     */
    public Mono<Void> handleResetCommand(Long chatId, String argument) {
        log.info("Обработка команды /reset для чата {}", chatId);
        if (argument.isEmpty()) {
            awaitingEmail.put(chatId, Boolean.TRUE);
            return reply(chatId, ASK_EMAIL_MESSAGE);
        }
        return submitEmail(chatId, argument);
    }

    public Mono<Void> handleCancelCommand(Long chatId) {
        awaitingEmail.invalidate(chatId);
        return reply(chatId, CANCELLED_MESSAGE);
    }

    public Mono<Void> handleTextMessage(Long chatId, String text) {
        if (awaitingEmail.getIfPresent(chatId) == null) {
            return reply(chatId, HELP_MESSAGE);
        }
        return submitEmail(chatId, text);
    }

    boolean isAwaitingEmail(Long chatId) {
        return awaitingEmail.getIfPresent(chatId) != null;
    }

    private Mono<Void> handleCallbackQuery(CallbackQuery callbackQuery) {
        Long chatId = callbackQuery.getMessage().getChatId();
        Mono<Void> answer = telegramMessageService.answerCallbackQuery(callbackQuery.getId())
                .onErrorResume(e -> Mono.empty());

        if (RESET_CALLBACK.equals(callbackQuery.getData())) {
            return answer.then(handleResetCommand(chatId, ""));
        }

        log.warn("Неизвестный callback {} от чата {}", callbackQuery.getData(), chatId);
        return answer;
    }

    private Mono<Void> submitEmail(Long chatId, String email) {
        if (!EmailUtil.isValid(email)) {
            awaitingEmail.put(chatId, Boolean.TRUE);
            return reply(chatId, INVALID_EMAIL_MESSAGE);
        }

        awaitingEmail.invalidate(chatId);
        return passwordResetService.startReset(email, ResetOrigin.TELEGRAM_BOT, "tg:" + chatId)
                .map(response -> "✅ " + response.getMessage())
                .onErrorResume(RateLimitExceededException.class, e -> Mono.just("⏳ " + e.getMessage()))
                .onErrorResume(StoreUnavailableException.class, e -> {
                    log.error("Хранилище недоступно при запросе сброса из чата {}", chatId, e);
                    return Mono.just(UNAVAILABLE_MESSAGE);
                })
                .flatMap(text -> reply(chatId, text));
    }

    private Mono<Void> reply(Long chatId, String text) {
        return telegramMessageService.sendMessage(chatId, text, null);
    }
}
