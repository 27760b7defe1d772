package ru.oparin.recovery.service.telegram;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.model.dto.telegram.TelegramApiResponse;
import ru.oparin.recovery.model.enums.DeliveryResult;

import java.time.Duration;

/**
 * Сервис для отправки сообщений через Telegram Bot API.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "telegram.bot.token")
public class TelegramMessageService {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    private final WebClient webClient;

    public TelegramMessageService(WebClient.Builder webClientBuilder,
                                  @Value("${telegram.bot.token}") String botToken,
                                  @Value("${telegram.bot.api-url:https://api.telegram.org}") String apiUrl) {
        this.webClient = webClientBuilder
                .baseUrl(apiUrl + "/bot" + botToken)
                .build();
    }

    /**
     * Отправить текст без разметки и вернуть классифицированный результат.
     * Ссылки с токенами содержат '_' и ломают Markdown, поэтому parse_mode не задается.
     *
     * @param chatId ID чата
     * @param text   текст сообщения
     * @return OK, TRANSIENT_FAILURE (429, 5xx, сеть) или PERMANENT_FAILURE (прочие 4xx)
     */
    public Mono<DeliveryResult> sendPlainMessage(Long chatId, String text) {
        log.info("Отправка сообщения со ссылкой в чат {}", chatId);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("text", text);
        body.add("disable_web_page_preview", "true");

        return webClient.post()
                .uri("/sendMessage")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(body))
                .exchangeToMono(response -> response.bodyToMono(TelegramApiResponse.class)
                        .defaultIfEmpty(new TelegramApiResponse())
                        .map(apiResponse -> classify(response.statusCode(), apiResponse, chatId)))
                .timeout(TIMEOUT)
                .onErrorResume(error -> {
                    log.warn("Ошибка сети при отправке сообщения в чат {}: {}", chatId, error.getMessage());
                    return Mono.just(DeliveryResult.TRANSIENT_FAILURE);
                });
    }

    /**
     * Отправить текстовое сообщение.
     *
     * @param chatId    ID чата
     * @param text      текст сообщения
     * @param parseMode режим парсинга (Markdown, HTML) или null
     */
    public Mono<Void> sendMessage(Long chatId, String text, String parseMode) {
        log.info("Отправка текстового сообщения в чат {}", chatId);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("text", text);
        if (parseMode != null) {
            body.add("parse_mode", parseMode);
        }

        return post("/sendMessage", body)
                .doOnSuccess(v -> log.debug("Сообщение успешно отправлено в чат {}", chatId))
                .doOnError(error -> log.error("Ошибка отправки сообщения в чат {}: {}", chatId, error.getMessage()));
    }

    /**
     * Отправить сообщение с inline-клавиатурой.
     *
     * @param chatId          ID чата
     * @param text            текст сообщения
     * @param replyMarkupJson JSON inline-клавиатура
     */
    public Mono<Void> sendMessageWithKeyboard(Long chatId, String text, String replyMarkupJson) {
        log.info("Отправка сообщения с клавиатурой в чат {}", chatId);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("text", text);
        body.add("parse_mode", "Markdown");
        body.add("reply_markup", replyMarkupJson);

        return post("/sendMessage", body)
                .doOnError(error -> log.warn("Ошибка отправки сообщения с клавиатурой в чат {}: {}", chatId, error.getMessage()));
    }

    /**
     * Ответить на callback query.
     *
     * @param callbackQueryId ID callback query
     */
    public Mono<Void> answerCallbackQuery(String callbackQueryId) {
        log.debug("Отправка ответа на callback query: {}", callbackQueryId);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("callback_query_id", callbackQueryId);

        return post("/answerCallbackQuery", body)
                .doOnError(error -> log.warn("Ошибка ответа на callback query {}: {}", callbackQueryId, error.getMessage()));
    }

    private Mono<Void> post(String method, MultiValueMap<String, String> body) {
        return webClient.post()
                .uri(method)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(body))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(TIMEOUT)
                .then();
    }

    static DeliveryResult classify(HttpStatusCode status, TelegramApiResponse apiResponse, Long chatId) {
        if (status.is2xxSuccessful() && Boolean.TRUE.equals(apiResponse.getOk())) {
            log.info("Сообщение доставлено в чат {}", chatId);
            return DeliveryResult.OK;
        }

        int code = apiResponse.getErrorCode() != null ? apiResponse.getErrorCode() : status.value();
        if (code == 429 || code >= 500) {
            log.warn("Telegram API временно недоступен для чата {}: {} - {}", chatId, code, apiResponse.getDescription());
            return DeliveryResult.TRANSIENT_FAILURE;
        }

        log.warn("Telegram API отклонил сообщение в чат {}: {} - {}", chatId, code, apiResponse.getDescription());
        return DeliveryResult.PERMANENT_FAILURE;
    }
}
