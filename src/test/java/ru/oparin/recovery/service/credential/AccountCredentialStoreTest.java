package ru.oparin.recovery.service.credential;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.test.StepVerifier;
import ru.oparin.recovery.model.dto.reset.AccountContact;
import ru.oparin.recovery.model.entity.Account;
import ru.oparin.recovery.repository.AccountRepository;
import ru.oparin.recovery.support.MutableClock;
import ru.oparin.recovery.support.TestClockConfig;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@Import(TestClockConfig.class)
class AccountCredentialStoreTest {

    @Autowired AccountCredentialStore credentialStore;
    @Autowired AccountRepository accountRepository;
    @Autowired PasswordEncoder passwordEncoder;
    @Autowired MutableClock clock;

    Account account;

    @BeforeEach
    void setUp() {
        accountRepository.deleteAll().block();
        account = accountRepository.save(Account.builder()
                        .email("store@example.com")
                        .password(passwordEncoder.encode("oldPassw0rd"))
                        .telegramChatId(777L)
                        .createdAt(LocalDateTime.now(clock))
                        .build())
                .block();
    }

    @Test
    void account_is_found_by_normalized_email() {
        StepVerifier.create(credentialStore.findAccount(" Store@Example.COM "))
                .expectNext(new AccountContact(String.valueOf(account.getId()), "store@example.com", 777L))
                .verifyComplete();
    }

    @Test
    void unknown_email_is_empty() {
        StepVerifier.create(credentialStore.findAccount("nobody@example.com"))
                .verifyComplete();
    }

    @Test
    void password_is_stored_as_bcrypt_hash() {
        StepVerifier.create(credentialStore.updatePassword(String.valueOf(account.getId()), "brandNewPassw0rd"))
                .verifyComplete();

        String hash = accountRepository.findById(account.getId()).block().getPassword();
        assertTrue(hash.startsWith("$2"));
        assertTrue(passwordEncoder.matches("brandNewPassw0rd", hash));
    }

    @Test
    void missing_account_fails_update() {
        StepVerifier.create(credentialStore.updatePassword("999999", "brandNewPassw0rd"))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void non_numeric_reference_fails_update() {
        StepVerifier.create(credentialStore.updatePassword("abc", "brandNewPassw0rd"))
                .expectError(IllegalArgumentException.class)
                .verify();
    }
}
