package ru.oparin.recovery.model.dto.reset;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import ru.oparin.recovery.validation.StrongPassword;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResetPasswordRequest {

    @NotBlank(message = "Токен обязателен")
    @ToString.Exclude
    private String token;

    @NotBlank(message = "Пароль обязателен")
    @StrongPassword
    @ToString.Exclude
    private String newPassword;
}
