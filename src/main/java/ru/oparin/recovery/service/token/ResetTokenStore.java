package ru.oparin.recovery.service.token;

import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcRollbackException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.config.properties.StoreProperties;
import ru.oparin.recovery.exception.StoreUnavailableException;
import ru.oparin.recovery.model.entity.ResetToken;
import ru.oparin.recovery.model.enums.DeliveryMarkResult;
import ru.oparin.recovery.model.enums.ResetTokenState;
import ru.oparin.recovery.repository.ResetTokenRepository;
import ru.oparin.recovery.util.SecureTokenUtil;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.TimeoutException;

/**
 * Хранилище токенов сброса пароля.
 * <p>
 * Единственный общий ресурс web-сервиса и воркера доставки. Инварианты
 * (один активный токен на аккаунт, одно успешное погашение, один захват для доставки)
 * обеспечиваются условными UPDATE, уникальным индексом и транзакциями, а не блокировками в памяти:
 * вызовы могут приходить из разных процессов.
 * <p>
 * Каждая операция ограничена {@code app.store.statement-timeout}. Таймаут и потеря соединения
 * превращаются в {@link StoreUnavailableException}.
 */
@Slf4j
@Service
public class ResetTokenStore {

    private final ResetTokenRepository tokenRepository;
    private final R2dbcEntityTemplate r2dbcEntityTemplate;
    private final Duration statementTimeout;

    public ResetTokenStore(ResetTokenRepository tokenRepository,
                           R2dbcEntityTemplate r2dbcEntityTemplate,
                           StoreProperties storeProperties) {
        this.tokenRepository = tokenRepository;
        this.r2dbcEntityTemplate = r2dbcEntityTemplate;
        this.statementTimeout = storeProperties.getStatementTimeout();
    }

    /**
     * Отозвать активные токены аккаунта и вставить новый одной транзакцией.
     * Параллельный выпуск для того же аккаунта упадет на уникальном индексе active_account_ref
     * и откатится целиком, поэтому окна с двумя активными токенами нет.
     */
    @Transactional
    public Mono<ResetToken> replaceActiveToken(ResetToken token) {
        return revokeActiveForAccount(token.getAccountRef(), token.getCreatedAt())
                .doOnNext(revoked -> {
                    if (revoked > 0) {
                        log.info("Отозвано {} активных токенов аккаунта {}", revoked, token.getAccountRef());
                    }
                })
                .then(insertToken(token));
    }

    public Mono<ResetToken> insertToken(ResetToken token) {
        return guard(r2dbcEntityTemplate.insert(ResetToken.class).using(token))
                .doOnNext(saved -> log.debug("Сохранен токен {} для аккаунта {}",
                        SecureTokenUtil.mask(saved.getId()), saved.getAccountRef()));
    }

    public Mono<Integer> revokeActiveForAccount(String accountRef, LocalDateTime now) {
        return guard(tokenRepository.revokeActiveForAccount(accountRef, now));
    }

    public Mono<ResetToken> findById(String id) {
        return guard(tokenRepository.findById(id));
    }

    /**
     * Токены, ожидающие доставки: PENDING, не помеченные как недоставляемые, не истекшие,
     * не исчерпавшие попытки и не захваченные другим воркером. Старые первыми.
     */
    public Flux<ResetToken> fetchPending(int limit, int maxAttempts, LocalDateTime now) {
        return tokenRepository.findPendingForDelivery(now, maxAttempts, limit)
                .timeout(statementTimeout)
                .onErrorMap(ResetTokenStore::isUnavailable, ResetTokenStore::unavailable);
    }

    /**
     * Захватить токен для отправки. Условный UPDATE гарантирует, что из нескольких воркеров
     * true получит только один; захват действует до now + claimTimeout.
     */
    public Mono<Boolean> claimForDelivery(String id, String workerId, LocalDateTime now, Duration claimTimeout) {
        return guard(tokenRepository.claimForDelivery(id, workerId, now, now.plus(claimTimeout)))
                .map(updated -> updated == 1);
    }

    /**
     * Перевести токен в DELIVERED. Повторный вызов ничего не меняет и возвращает ALREADY_DELIVERED.
     */
    public Mono<DeliveryMarkResult> markDelivered(String id, LocalDateTime now) {
        return guard(tokenRepository.markDelivered(id, now))
                .flatMap(updated -> {
                    if (updated == 1) {
                        return Mono.just(DeliveryMarkResult.MARKED);
                    }
                    return findById(id)
                            .map(token -> token.getState() == ResetTokenState.DELIVERED
                                    ? DeliveryMarkResult.ALREADY_DELIVERED
                                    : DeliveryMarkResult.NOT_DELIVERABLE)
                            .defaultIfEmpty(DeliveryMarkResult.NOT_FOUND);
                });
    }

    /**
     * Учесть неудачную попытку отправки и снять захват.
     *
     * @param permanent true - канал сообщил о постоянной ошибке, больше не пытаться
     * @return false, если токен уже не принадлежит этому воркеру или перестал быть PENDING
     */
    public Mono<Boolean> recordDeliveryFailure(String id, String workerId, boolean permanent, String error) {
        return guard(tokenRepository.recordDeliveryFailure(id, workerId, permanent, truncate(error)))
                .map(updated -> updated == 1);
    }

    /**
     * Погасить токен, если он активен и не истек. Ровно один из конкурирующих вызовов получит true.
     */
    public Mono<Boolean> markConsumedIfValid(String id, LocalDateTime now) {
        return guard(tokenRepository.markConsumedIfValid(id, now))
                .map(updated -> updated == 1);
    }

    /**
     * Ленивый перевод одного токена в EXPIRED, если он еще не в конечном состоянии.
     */
    public Mono<Boolean> markExpired(String id, LocalDateTime now) {
        return guard(tokenRepository.markExpired(id, now))
                .map(updated -> updated == 1);
    }

    /**
     * Перевести все просроченные активные токены в EXPIRED.
     *
     * @return количество переведенных токенов
     */
    public Mono<Integer> markExpiredSweep(LocalDateTime now) {
        return guard(tokenRepository.markExpiredSweep(now));
    }

    /**
     * Удалить закрытые токены, закрытые раньше before.
     */
    public Mono<Integer> purgeClosed(LocalDateTime before) {
        return guard(tokenRepository.deleteClosedBefore(before));
    }

    private <T> Mono<T> guard(Mono<T> operation) {
        return operation
                .timeout(statementTimeout)
                .onErrorMap(ResetTokenStore::isUnavailable, ResetTokenStore::unavailable);
    }

    /**
     * Конфликт уникального индекса при параллельном выпуске или конкурентное обновление строки.
     * Такие ошибки лечатся повтором всей транзакции.
     */
    static boolean isConflict(Throwable error) {
        return error instanceof DataIntegrityViolationException
                || error instanceof R2dbcDataIntegrityViolationException
                || error instanceof ConcurrencyFailureException
                || error instanceof R2dbcRollbackException;
    }

    static boolean isUnavailable(Throwable error) {
        if (error instanceof StoreUnavailableException || isConflict(error)) {
            return false;
        }
        return error instanceof TimeoutException
                || error instanceof DataAccessException
                || error instanceof R2dbcException;
    }

    private static Throwable unavailable(Throwable error) {
        log.error("Хранилище токенов недоступно: {}", error.getMessage());
        return new StoreUnavailableException("Хранилище токенов недоступно", error);
    }

    private static String truncate(String error) {
        if (error == null) {
            return "unknown";
        }
        return error.length() > 500 ? error.substring(0, 500) : error;
    }
}
