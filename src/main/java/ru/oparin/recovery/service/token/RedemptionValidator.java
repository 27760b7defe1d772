package ru.oparin.recovery.service.token;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.model.dto.reset.RedemptionResult;
import ru.oparin.recovery.model.entity.ResetToken;
import ru.oparin.recovery.model.enums.RedemptionOutcome;
import ru.oparin.recovery.model.enums.ResetTokenState;
import ru.oparin.recovery.util.SecureTokenUtil;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Проверка и погашение токенов сброса пароля.
 * <p>
 * Погашение - один условный UPDATE (PENDING/DELIVERED и не истек → CONSUMED).
 * Из конкурирующих запросов с одним токеном строку обновит только один, остальные
 * увидят CONSUMED и получат ALREADY_USED. Остальные исходы определяются чтением строки
 * после неудачного UPDATE.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedemptionValidator {

    private final ResetTokenStore tokenStore;
    private final Clock clock;

    /**
     * Погасить токен.
     *
     * @param tokenId значение из ссылки
     * @return OK с accountRef, либо INVALID / EXPIRED / ALREADY_USED
     */
    public Mono<RedemptionResult> redeem(String tokenId) {
        if (!SecureTokenUtil.isWellFormed(tokenId)) {
            log.warn("Попытка погасить токен неверного формата");
            return Mono.just(RedemptionResult.rejected(RedemptionOutcome.INVALID));
        }

        LocalDateTime now = LocalDateTime.now(clock);

        return tokenStore.markConsumedIfValid(tokenId, now)
                .flatMap(consumed -> tokenStore.findById(tokenId)
                        .filter(token -> SecureTokenUtil.constantTimeEquals(token.getId(), tokenId))
                        .flatMap(token -> consumed
                                ? Mono.just(RedemptionResult.ok(token.getAccountRef()))
                                : classifyRejected(token, now))
                        .defaultIfEmpty(RedemptionResult.rejected(RedemptionOutcome.INVALID)))
                .doOnNext(result -> logResult(tokenId, result));
    }

    /**
     * Проверить токен без погашения (перед показом формы нового пароля).
     * Состояние не меняется, кроме ленивого перевода просроченного токена в EXPIRED.
     *
     * @return OK, если токен сейчас можно погасить
     */
    public Mono<RedemptionOutcome> inspect(String tokenId) {
        if (!SecureTokenUtil.isWellFormed(tokenId)) {
            return Mono.just(RedemptionOutcome.INVALID);
        }

        LocalDateTime now = LocalDateTime.now(clock);

        return tokenStore.findById(tokenId)
                .filter(token -> SecureTokenUtil.constantTimeEquals(token.getId(), tokenId))
                .flatMap(token -> {
                    if (ResetTokenState.isActive(token.getState()) && !token.isExpiredAt(now)) {
                        return Mono.just(RedemptionOutcome.OK);
                    }
                    return classifyRejected(token, now).map(RedemptionResult::getOutcome);
                })
                .defaultIfEmpty(RedemptionOutcome.INVALID);
    }

    /**
     * Разобрать, почему токен не удалось погасить. Порядок проверок важен:
     * использованный токен всегда ALREADY_USED, далее время важнее хранимого состояния.
     */
    private Mono<RedemptionResult> classifyRejected(ResetToken token, LocalDateTime now) {
        if (token.getState() == ResetTokenState.CONSUMED) {
            return Mono.just(RedemptionResult.rejected(RedemptionOutcome.ALREADY_USED));
        }

        if (token.isExpiredAt(now) || token.getState() == ResetTokenState.EXPIRED) {
            Mono<Boolean> expire = ResetTokenState.isTerminal(token.getState())
                    ? Mono.just(false)
                    : tokenStore.markExpired(token.getId(), now);
            return expire
                    .doOnNext(expired -> {
                        if (expired) {
                            log.info("Токен {} аккаунта {} переведен в EXPIRED при проверке",
                                    SecureTokenUtil.mask(token.getId()), token.getAccountRef());
                        }
                    })
                    .thenReturn(RedemptionResult.rejected(RedemptionOutcome.EXPIRED));
        }

        if (token.getState() == ResetTokenState.REVOKED) {
            return Mono.just(RedemptionResult.rejected(RedemptionOutcome.INVALID));
        }

        // строка успела смениться между UPDATE и чтением
        log.warn("Токен {} в состоянии {} не удалось погасить", SecureTokenUtil.mask(token.getId()), token.getState());
        return Mono.just(RedemptionResult.rejected(RedemptionOutcome.INVALID));
    }

    private void logResult(String tokenId, RedemptionResult result) {
        if (result.isOk()) {
            log.info("Токен {} погашен для аккаунта {}", SecureTokenUtil.mask(tokenId), result.getAccountRef());
        } else {
            log.warn("Токен {} отклонен: {}", SecureTokenUtil.mask(tokenId), result.getOutcome());
        }
    }
}
