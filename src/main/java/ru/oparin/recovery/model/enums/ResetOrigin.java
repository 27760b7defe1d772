package ru.oparin.recovery.model.enums;

/**
 * Откуда пришел запрос на сброс пароля. Используется в логах и для ключа rate limiting.
 */
public enum ResetOrigin {
    WEB,
    TELEGRAM_BOT
}
