package ru.oparin.recovery.model.enums;

/**
 * Канал, через который пользователю доставляется ссылка для сброса пароля.
 */
public enum DeliveryChannel {
    TELEGRAM,
    EMAIL
}
