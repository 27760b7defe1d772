package ru.oparin.recovery.model.dto.reset;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ответ на предварительную проверку ссылки (перед показом формы нового пароля).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenCheckResponse {
    private boolean valid;
    private String message;
}
