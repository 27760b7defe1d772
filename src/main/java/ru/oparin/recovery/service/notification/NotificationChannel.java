package ru.oparin.recovery.service.notification;

import reactor.core.publisher.Mono;
import ru.oparin.recovery.model.enums.DeliveryChannel;
import ru.oparin.recovery.model.enums.DeliveryResult;

/**
 * Канал доставки ссылки для сброса пароля.
 * <p>
 * Реализация не бросает исключений из-за сбоев транспорта: любая ошибка
 * должна быть сведена к {@link DeliveryResult#TRANSIENT_FAILURE} или
 * {@link DeliveryResult#PERMANENT_FAILURE}, чтобы воркер решил, повторять ли попытку.
 */
public interface NotificationChannel {

    /**
     * Какой канал обслуживает реализация.
     */
    DeliveryChannel getChannel();

    /**
     * Отправить ссылку.
     *
     * @param contact   адрес в канале (chat id, email)
     * @param resetLink готовая ссылка со встроенным токеном
     * @return результат отправки
     */
    Mono<DeliveryResult> send(String contact, String resetLink);
}
