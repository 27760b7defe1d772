package ru.oparin.recovery.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.model.entity.Account;

import java.time.LocalDateTime;

public interface AccountRepository extends ReactiveCrudRepository<Account, Long> {

    Mono<Account> findByEmail(String email);

    @Modifying
    @Query("UPDATE recovery.account SET password = :passwordHash, updated_at = :now WHERE id = :id")
    Mono<Integer> updatePassword(Long id, String passwordHash, LocalDateTime now);
}
