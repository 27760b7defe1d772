package ru.oparin.recovery.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.model.entity.ResetToken;

import java.time.LocalDateTime;

/**
 * Репозиторий токенов сброса пароля.
 * Все переходы состояний выполняются условными UPDATE: число затронутых строк показывает,
 * выиграл ли вызывающий гонку с другим процессом.
 */
@Repository
public interface ResetTokenRepository extends ReactiveCrudRepository<ResetToken, String> {

    @Query("SELECT * FROM recovery.reset_tokens WHERE state = 'PENDING' AND delivery_failed = FALSE " +
            "AND expires_at > :now AND delivery_attempts < :maxAttempts " +
            "AND (claimed_until IS NULL OR claimed_until < :now) " +
            "ORDER BY created_at ASC LIMIT :limit")
    Flux<ResetToken> findPendingForDelivery(LocalDateTime now, int maxAttempts, int limit);

    @Modifying
    @Query("UPDATE recovery.reset_tokens SET state = 'REVOKED', active_account_ref = NULL, closed_at = :now, " +
            "claimed_by = NULL, claimed_until = NULL " +
            "WHERE account_ref = :accountRef AND state IN ('PENDING', 'DELIVERED')")
    Mono<Integer> revokeActiveForAccount(String accountRef, LocalDateTime now);

    @Modifying
    @Query("UPDATE recovery.reset_tokens SET claimed_by = :workerId, claimed_until = :claimedUntil " +
            "WHERE id = :id AND state = 'PENDING' AND delivery_failed = FALSE " +
            "AND (claimed_until IS NULL OR claimed_until < :now)")
    Mono<Integer> claimForDelivery(String id, String workerId, LocalDateTime now, LocalDateTime claimedUntil);

    @Modifying
    @Query("UPDATE recovery.reset_tokens SET state = 'DELIVERED', delivered_at = :now, " +
            "delivery_attempts = delivery_attempts + 1, last_delivery_error = NULL, " +
            "claimed_by = NULL, claimed_until = NULL " +
            "WHERE id = :id AND state = 'PENDING'")
    Mono<Integer> markDelivered(String id, LocalDateTime now);

    @Modifying
    @Query("UPDATE recovery.reset_tokens SET delivery_attempts = delivery_attempts + 1, " +
            "delivery_failed = :permanent, last_delivery_error = :error, " +
            "claimed_by = NULL, claimed_until = NULL " +
            "WHERE id = :id AND state = 'PENDING' AND claimed_by = :workerId")
    Mono<Integer> recordDeliveryFailure(String id, String workerId, boolean permanent, String error);

    @Modifying
    @Query("UPDATE recovery.reset_tokens SET state = 'CONSUMED', consumed_at = :now, active_account_ref = NULL, " +
            "claimed_by = NULL, claimed_until = NULL " +
            "WHERE id = :id AND state IN ('PENDING', 'DELIVERED') AND expires_at > :now")
    Mono<Integer> markConsumedIfValid(String id, LocalDateTime now);

    @Modifying
    @Query("UPDATE recovery.reset_tokens SET state = 'EXPIRED', closed_at = :now, active_account_ref = NULL, " +
            "claimed_by = NULL, claimed_until = NULL " +
            "WHERE id = :id AND state IN ('PENDING', 'DELIVERED') AND expires_at <= :now")
    Mono<Integer> markExpired(String id, LocalDateTime now);

    @Modifying
    @Query("UPDATE recovery.reset_tokens SET state = 'EXPIRED', closed_at = :now, active_account_ref = NULL, " +
            "claimed_by = NULL, claimed_until = NULL " +
            "WHERE state IN ('PENDING', 'DELIVERED') AND expires_at <= :now")
    Mono<Integer> markExpiredSweep(LocalDateTime now);

    @Modifying
    @Query("DELETE FROM recovery.reset_tokens WHERE state IN ('CONSUMED', 'EXPIRED', 'REVOKED') " +
            "AND COALESCE(consumed_at, closed_at) < :before")
    Mono<Integer> deleteClosedBefore(LocalDateTime before);
}
