package ru.oparin.recovery.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.model.dto.reset.ForgotPasswordRequest;
import ru.oparin.recovery.model.dto.reset.MessageResponse;
import ru.oparin.recovery.model.dto.reset.ResetPasswordRequest;
import ru.oparin.recovery.model.dto.reset.TokenCheckResponse;
import ru.oparin.recovery.model.enums.ResetOrigin;
import ru.oparin.recovery.service.PasswordResetService;
import ru.oparin.recovery.util.EmailUtil;
import ru.oparin.recovery.util.IpUtil;

@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/password-reset")
@Tag(name = "Восстановление пароля", description = "API для сброса пароля по одноразовой ссылке")
public class PasswordResetController {

    private final PasswordResetService passwordResetService;

    @Operation(summary = "Запрос восстановления пароля",
            description = "Выпускает одноразовую ссылку и ставит ее в очередь на доставку. Ответ не зависит от существования аккаунта")
    @PostMapping("/request")
    public Mono<ResponseEntity<MessageResponse>> requestReset(@Valid @RequestBody ForgotPasswordRequest request,
                                                              ServerHttpRequest httpRequest) {
        String clientIp = IpUtil.extractClientIp(httpRequest);
        log.info("Получен запрос на восстановление пароля для email: {}, IP: {}",
                EmailUtil.mask(request.getIdentifier()), clientIp);
        return passwordResetService.startReset(request.getIdentifier(), ResetOrigin.WEB, "ip:" + clientIp)
                .map(response -> ResponseEntity.status(HttpStatus.ACCEPTED).body(response));
    }

    @Operation(summary = "Проверка ссылки",
            description = "Проверяет, можно ли еще сменить пароль по ссылке. Ссылка при этом не расходуется")
    @GetMapping("/check")
    public Mono<ResponseEntity<TokenCheckResponse>> checkToken(@RequestParam("token") String token) {
        return passwordResetService.checkToken(token)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Сброс пароля",
            description = "Устанавливает новый пароль по токену из ссылки")
    @PostMapping("/complete")
    public Mono<ResponseEntity<MessageResponse>> completeReset(@Valid @RequestBody ResetPasswordRequest request) {
        log.info("Получен запрос на сброс пароля с токеном");
        return passwordResetService.completeReset(request.getToken(), request.getNewPassword())
                .map(ResponseEntity::ok);
    }
}
