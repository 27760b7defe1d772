package ru.oparin.recovery.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Аккаунт пользователя в хранилище учетных данных по умолчанию.
 * Ядро сброса пароля работает только с его строковым идентификатором.
 */
@Table(value = "account", schema = "recovery")
@Getter
@Setter
@EqualsAndHashCode
@ToString(exclude = "password")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    @Id
    private Long id;

    /**
     * Email адрес, по которому пользователь запрашивает сброс.
     */
    private String email;

    /**
     * Хэш пароля (bcrypt).
     */
    private String password;

    /**
     * ID чата с ботом, если пользователь привязал Telegram.
     */
    private Long telegramChatId;

    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;
}
