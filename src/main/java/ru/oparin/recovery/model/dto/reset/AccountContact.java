package ru.oparin.recovery.model.dto.reset;

import lombok.Value;

/**
 * Данные аккаунта, нужные для выбора канала доставки.
 */
@Value
public class AccountContact {
    String accountRef;
    String email;
    Long telegramChatId;
}
