package ru.oparin.recovery.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.recovery.model.enums.RedemptionOutcome;

/**
 * Отказ в сбросе пароля по вине пользователя: неверная, использованная или просроченная ссылка.
 */
public class PasswordResetException extends RuntimeException {
    @Getter
    private final HttpStatus status;

    @Getter
    private final RedemptionOutcome outcome;

    public PasswordResetException(RedemptionOutcome outcome, String message) {
        super(message);
        this.status = HttpStatus.BAD_REQUEST;
        this.outcome = outcome;
    }
}
