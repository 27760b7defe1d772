package ru.oparin.recovery.model.enums;

/**
 * Состояния токена сброса пароля.
 * Переходы возможны только вперед: PENDING → DELIVERED → CONSUMED,
 * либо из PENDING/DELIVERED в EXPIRED или REVOKED.
 */
public enum ResetTokenState {

    /**
     * Токен выпущен и ждет доставки.
     */
    PENDING,

    /**
     * Ссылка доставлена пользователю.
     */
    DELIVERED,

    /**
     * Токен использован для смены пароля.
     */
    CONSUMED,

    /**
     * Срок действия истек.
     */
    EXPIRED,

    /**
     * Токен отозван более новым запросом для того же аккаунта.
     */
    REVOKED;

    /**
     * Проверить, можно ли еще использовать токен (при условии, что срок не истек).
     *
     * @param state состояние для проверки
     * @return true для PENDING и DELIVERED
     */
    public static boolean isActive(ResetTokenState state) {
        return state == PENDING || state == DELIVERED;
    }

    /**
     * Проверить, является ли состояние конечным.
     */
    public static boolean isTerminal(ResetTokenState state) {
        return state == CONSUMED || state == EXPIRED || state == REVOKED;
    }
}
