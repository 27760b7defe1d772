package ru.oparin.recovery.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.recovery.model.enums.DeliveryChannel;
import ru.oparin.recovery.model.enums.ResetTokenState;

import java.time.LocalDateTime;

/**
 * Токен сброса пароля.
 * Общая таблица для web-сервиса и воркера доставки: других каналов связи между процессами нет.
 */
@Table(value = "reset_tokens", schema = "recovery")
@Getter
@Setter
@EqualsAndHashCode
@ToString(exclude = "id")
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResetToken {

    /**
     * Секрет, который попадает в ссылку. Генерируется SecureRandom, не угадывается.
     */
    @Id
    private String id;

    /**
     * Идентификатор аккаунта, для которого выпущен токен.
     */
    private String accountRef;

    /**
     * Совпадает с accountRef, пока токен активен (PENDING/DELIVERED), иначе null.
     * На колонке уникальный индекс: база сама не даст существовать двум активным токенам одного аккаунта.
     */
    private String activeAccountRef;

    private ResetTokenState state;

    /**
     * Канал доставки, выбранный при выпуске.
     */
    private DeliveryChannel channel;

    /**
     * Адрес в канале: chat id для Telegram или email.
     */
    private String contact;

    private LocalDateTime createdAt;

    private LocalDateTime expiresAt;

    private LocalDateTime deliveredAt;

    private LocalDateTime consumedAt;

    /**
     * Момент перехода в EXPIRED или REVOKED.
     */
    private LocalDateTime closedAt;

    @Builder.Default
    private Integer deliveryAttempts = 0;

    /**
     * Доставка невозможна (постоянная ошибка канала). Токен остается PENDING до истечения срока.
     */
    @Builder.Default
    private Boolean deliveryFailed = false;

    private String lastDeliveryError;

    /**
     * Воркер, захвативший токен для отправки.
     */
    private String claimedBy;

    /**
     * До какого момента действует захват. Просроченный захват может забрать другой воркер.
     */
    private LocalDateTime claimedUntil;

    /**
     * Проверить, истек ли срок действия на момент now.
     */
    public boolean isExpiredAt(LocalDateTime now) {
        return !now.isBefore(expiresAt);
    }
}
