package ru.oparin.recovery.service.token;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import ru.oparin.recovery.config.properties.ResetProperties;
import ru.oparin.recovery.model.dto.reset.DeliveryTarget;
import ru.oparin.recovery.model.entity.ResetToken;
import ru.oparin.recovery.model.enums.ResetTokenState;
import ru.oparin.recovery.util.SecureTokenUtil;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Выпуск токенов сброса пароля.
 * <p>
 * Существование аккаунта здесь не проверяется: это делает вызывающий, выравнивая время ответа.
 * Уведомления не отправляются, доставкой занимается воркер.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResetTokenIssuer {

    private final ResetTokenStore tokenStore;
    private final ResetProperties resetProperties;
    private final SecureRandom secureRandom;
    private final Clock clock;

    /**
     * Выпустить новый токен для аккаунта, отозвав предыдущий активный.
     *
     * @param accountRef идентификатор аккаунта
     * @param target     куда воркер доставит ссылку
     * @return сохраненный токен в состоянии PENDING
     */
    public Mono<ResetToken> issue(String accountRef, DeliveryTarget target) {
        int attempts = Math.max(1, resetProperties.getIssueAttempts());

        return Mono.defer(() -> tokenStore.replaceActiveToken(newToken(accountRef, target)))
                .retryWhen(Retry.backoff(attempts - 1, Duration.ofMillis(20))
                        .filter(ResetTokenStore::isConflict)
                        .doBeforeRetry(signal -> log.warn("Конфликт при выпуске токена для аккаунта {}, попытка {}",
                                accountRef, signal.totalRetries() + 2))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnSuccess(token -> log.info("Выпущен токен {} для аккаунта {}, канал {}, действует до {}",
                        SecureTokenUtil.mask(token.getId()), accountRef, token.getChannel(), token.getExpiresAt()));
    }

    private ResetToken newToken(String accountRef, DeliveryTarget target) {
        LocalDateTime now = LocalDateTime.now(clock);

        return ResetToken.builder()
                .id(SecureTokenUtil.generate(secureRandom, resetProperties.getTokenBytes()))
                .accountRef(accountRef)
                .activeAccountRef(accountRef)
                .state(ResetTokenState.PENDING)
                .channel(target.getChannel())
                .contact(target.getContact())
                .createdAt(now)
                .expiresAt(now.plus(resetProperties.getTokenTtl()))
                .build();
    }
}
