package ru.oparin.recovery.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Токен погашен, но записать новый пароль не удалось. Токен повторно не используется,
 * пользователь должен запросить новую ссылку.
 */
public class CredentialUpdateException extends RuntimeException {
    @Getter
    private final HttpStatus status = HttpStatus.CONFLICT;

    public CredentialUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
