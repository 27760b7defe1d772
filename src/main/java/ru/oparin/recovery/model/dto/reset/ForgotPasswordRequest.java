package ru.oparin.recovery.model.dto.reset;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ForgotPasswordRequest {

    /**
     * Email аккаунта.
     */
    @NotBlank(message = "Email обязателен")
    @Size(max = 255, message = "Слишком длинный email")
    private String identifier;
}
