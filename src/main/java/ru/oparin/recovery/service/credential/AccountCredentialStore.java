package ru.oparin.recovery.service.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.recovery.model.dto.reset.AccountContact;
import ru.oparin.recovery.repository.AccountRepository;
import ru.oparin.recovery.util.EmailUtil;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Хранилище учетных данных по умолчанию: таблица recovery.account, пароли в bcrypt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountCredentialStore implements CredentialStore {

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Override
    public Mono<AccountContact> findAccount(String identifier) {
        return accountRepository.findByEmail(EmailUtil.normalize(identifier))
                .map(account -> new AccountContact(
                        String.valueOf(account.getId()), account.getEmail(), account.getTelegramChatId()));
    }

    @Override
    public Mono<Void> updatePassword(String accountRef, String newPassword) {
        Long accountId;
        try {
            accountId = Long.valueOf(accountRef);
        } catch (NumberFormatException e) {
            return Mono.error(new IllegalArgumentException("Некорректный идентификатор аккаунта: " + accountRef));
        }

        // bcrypt медленный, не держим event loop
        return Mono.fromCallable(() -> passwordEncoder.encode(newPassword))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(hash -> accountRepository.updatePassword(accountId, hash, LocalDateTime.now(clock)))
                .flatMap(updated -> updated == 1
                        ? Mono.<Void>empty()
                        : Mono.error(new IllegalStateException("Аккаунт " + accountRef + " не найден")))
                .doOnSuccess(v -> log.info("Пароль аккаунта {} обновлен", accountRef));
    }
}
