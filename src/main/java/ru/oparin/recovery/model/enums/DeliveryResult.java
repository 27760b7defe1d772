package ru.oparin.recovery.model.enums;

/**
 * Результат попытки отправки ссылки через канал уведомлений.
 */
public enum DeliveryResult {

    /**
     * Канал подтвердил отправку.
     */
    OK,

    /**
     * Временная ошибка (таймаут, 5xx, лимит запросов). Попытка будет повторена.
     */
    TRANSIENT_FAILURE,

    /**
     * Постоянная ошибка (чат не найден, бот заблокирован, неверный адрес).
     * Повторять бессмысленно.
     */
    PERMANENT_FAILURE
}
