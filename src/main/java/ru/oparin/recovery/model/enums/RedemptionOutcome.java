package ru.oparin.recovery.model.enums;

/**
 * Исход попытки использовать токен сброса пароля.
 */
public enum RedemptionOutcome {
    OK,
    INVALID,
    EXPIRED,
    ALREADY_USED
}
