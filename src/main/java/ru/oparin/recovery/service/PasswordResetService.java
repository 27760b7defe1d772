package ru.oparin.recovery.service;

import io.r2dbc.spi.R2dbcException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.config.DatabaseConfig;
import ru.oparin.recovery.config.properties.ResetProperties;
import ru.oparin.recovery.exception.CredentialUpdateException;
import ru.oparin.recovery.exception.PasswordResetException;
import ru.oparin.recovery.exception.RateLimitExceededException;
import ru.oparin.recovery.exception.StoreUnavailableException;
import ru.oparin.recovery.model.dto.reset.AccountContact;
import ru.oparin.recovery.model.dto.reset.DeliveryTarget;
import ru.oparin.recovery.model.dto.reset.MessageResponse;
import ru.oparin.recovery.model.dto.reset.TokenCheckResponse;
import ru.oparin.recovery.model.enums.DeliveryChannel;
import ru.oparin.recovery.model.enums.RedemptionOutcome;
import ru.oparin.recovery.model.enums.ResetOrigin;
import ru.oparin.recovery.service.credential.CredentialStore;
import ru.oparin.recovery.service.token.RedemptionValidator;
import ru.oparin.recovery.service.token.ResetTokenIssuer;
import ru.oparin.recovery.util.EmailUtil;

/**
 * Сценарии сброса пароля для web-слоя и Telegram бота.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetService {

    public static final String RESET_REQUESTED_MESSAGE =
            "Если аккаунт с таким email существует, мы отправили ссылку для восстановления пароля";
    public static final String PASSWORD_CHANGED_MESSAGE = "Пароль успешно изменен";

    private final CredentialStore credentialStore;
    private final ResetTokenIssuer tokenIssuer;
    private final RedemptionValidator redemptionValidator;
    private final RateLimitingService rateLimitingService;
    private final ResetProperties resetProperties;

    /**
     * Запросить сброс пароля.
     * <p>
     * Ответ одинаковый и приходит не раньше {@code app.reset.min-response-time} независимо от того,
     * существует ли аккаунт: по ответу нельзя перебрать зарегистрированные email.
     *
     * @param identifier email аккаунта
     * @param origin     откуда пришел запрос
     * @param clientKey  IP или chat id для ограничения частоты
     */
    public Mono<MessageResponse> startReset(String identifier, ResetOrigin origin, String clientKey) {
        String email = EmailUtil.normalize(identifier);
        log.info("Запрос на восстановление пароля ({}) для email: {}", origin, EmailUtil.mask(email));

        return rateLimitingService.tryAcquire(origin.name() + ":" + clientKey)
                .flatMap(allowed -> allowed
                        ? Mono.when(issueIfAccountExists(email), Mono.delay(resetProperties.getMinResponseTime()))
                        : Mono.<Void>error(new RateLimitExceededException("Слишком много запросов. Попробуйте позже")))
                .thenReturn(new MessageResponse(RESET_REQUESTED_MESSAGE));
    }

    /**
     * Сменить пароль по ссылке.
     * <p>
     * Токен гасится до записи пароля. Если запись не удалась, токен все равно остается
     * использованным, и пользователь получает отдельную ошибку с просьбой запросить новую ссылку.
     * Автоматических повторов нет: повтор мог бы увидеть собственное погашение как ALREADY_USED.
     */
    public Mono<MessageResponse> completeReset(String token, String newPassword) {
        return redemptionValidator.redeem(token)
                .flatMap(result -> {
                    if (!result.isOk()) {
                        return Mono.error(rejection(result.getOutcome()));
                    }
                    return credentialStore.updatePassword(result.getAccountRef(), newPassword)
                            .onErrorMap(e -> new CredentialUpdateException(
                                    "Не удалось сменить пароль. Ссылка больше недействительна, запросите новую", e))
                            .thenReturn(new MessageResponse(PASSWORD_CHANGED_MESSAGE))
                            .doOnSuccess(response -> log.info("Пароль успешно сброшен для аккаунта: {}",
                                    result.getAccountRef()));
                });
    }

    /**
     * Проверить ссылку перед показом формы нового пароля. Токен не гасится.
     */
    public Mono<TokenCheckResponse> checkToken(String token) {
        return DatabaseConfig.withRetry(redemptionValidator.inspect(token))
                .map(outcome -> outcome == RedemptionOutcome.OK
                        ? new TokenCheckResponse(true, "Введите новый пароль")
                        : new TokenCheckResponse(false, messageFor(outcome)));
    }

    private Mono<Void> issueIfAccountExists(String email) {
        if (!EmailUtil.isValid(email)) {
            log.warn("Запрос на восстановление пароля с некорректным email");
            return Mono.empty();
        }

        return credentialStore.findAccount(email)
                .onErrorMap(e -> e instanceof DataAccessException || e instanceof R2dbcException,
                        e -> new StoreUnavailableException("Хранилище аккаунтов недоступно", e))
                .flatMap(account -> DatabaseConfig.withRetry(tokenIssuer.issue(account.getAccountRef(), resolveTarget(account))))
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Попытка восстановления пароля для несуществующего email: {}", EmailUtil.mask(email));
                    return Mono.empty();
                }))
                .then();
    }

    /**
     * Предпочитаемый канал, если у аккаунта есть в нем адрес, иначе email.
     */
    DeliveryTarget resolveTarget(AccountContact account) {
        if (resetProperties.getPreferredChannel() == DeliveryChannel.TELEGRAM && account.getTelegramChatId() != null) {
            return new DeliveryTarget(DeliveryChannel.TELEGRAM, String.valueOf(account.getTelegramChatId()));
        }
        return new DeliveryTarget(DeliveryChannel.EMAIL, account.getEmail());
    }

    private PasswordResetException rejection(RedemptionOutcome outcome) {
        return new PasswordResetException(outcome, messageFor(outcome));
    }

    static String messageFor(RedemptionOutcome outcome) {
        return switch (outcome) {
            case EXPIRED -> "Срок действия ссылки истек. Запросите восстановление пароля заново";
            case ALREADY_USED -> "Ссылка уже была использована. Запросите восстановление пароля заново";
            default -> "Ссылка недействительна. Запросите восстановление пароля заново";
        };
    }
}
