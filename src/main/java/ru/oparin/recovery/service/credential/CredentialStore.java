package ru.oparin.recovery.service.credential;

import reactor.core.publisher.Mono;
import ru.oparin.recovery.model.dto.reset.AccountContact;

/**
 * Хранилище учетных данных аккаунтов.
 * Ядро сброса пароля знает только строковый идентификатор аккаунта и не работает с хэшами.
 */
public interface CredentialStore {

    /**
     * Найти аккаунт по идентификатору, который ввел пользователь (email).
     *
     * @return контакты аккаунта или пустой Mono, если аккаунта нет
     */
    Mono<AccountContact> findAccount(String identifier);

    /**
     * Установить новый пароль аккаунту.
     *
     * @param accountRef  идентификатор аккаунта из токена
     * @param newPassword новый пароль в открытом виде
     * @return пустой Mono при успехе, ошибка - если записать не удалось
     */
    Mono<Void> updatePassword(String accountRef, String newPassword);
}
