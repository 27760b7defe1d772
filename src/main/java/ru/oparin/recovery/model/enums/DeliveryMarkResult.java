package ru.oparin.recovery.model.enums;

/**
 * Результат перевода токена в состояние DELIVERED.
 */
public enum DeliveryMarkResult {
    MARKED,
    ALREADY_DELIVERED,
    NOT_FOUND,
    /**
     * Пока шла отправка, токен был отозван, использован или истек.
     */
    NOT_DELIVERABLE
}
