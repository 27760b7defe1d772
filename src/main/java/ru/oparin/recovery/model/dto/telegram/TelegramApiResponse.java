package ru.oparin.recovery.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * DTO для ответа от Telegram Bot API.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramApiResponse {

    private Boolean ok;
    private TelegramMessage result;

    @JsonProperty("error_code")
    private Integer errorCode;

    private String description;

    private Parameters parameters;

    /**
     * Дополнительные параметры ошибки (например, retry_after при 429).
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Parameters {

        @JsonProperty("retry_after")
        private Integer retryAfter;

        @JsonProperty("migrate_to_chat_id")
        private Long migrateToChatId;
    }
}
