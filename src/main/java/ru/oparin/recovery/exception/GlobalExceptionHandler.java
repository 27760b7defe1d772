package ru.oparin.recovery.exception;

import jakarta.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAllExceptions(Exception ex) {
        log.error("Неизвестная ошибка: ", ex);

        return Mono.just(ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", "Внутренняя ошибка сервера",
                        "status", 500
                )));
    }

    @ExceptionHandler(PasswordResetException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handlePasswordResetException(PasswordResetException ex) {
        log.warn("Отказ в сбросе пароля: {}", ex.getOutcome());

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value()
                )));
    }

    @ExceptionHandler(CredentialUpdateException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleCredentialUpdateException(CredentialUpdateException ex) {
        log.error("Ошибка записи нового пароля: {}", ex.getMessage(), ex.getCause());

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value()
                )));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleRateLimitExceededException(RateLimitExceededException ex) {
        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value()
                )));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleStoreUnavailableException(StoreUnavailableException ex) {
        log.error("Хранилище токенов недоступно: {}", ex.getMessage());

        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of(
                        "error", "Сервис временно недоступен. Попробуйте позже",
                        "status", HttpStatus.SERVICE_UNAVAILABLE.value()
                )));
    }

    @ExceptionHandler(ValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(ValidationException ex) {
        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации",
                        "status", 400,
                        "details", ex.getMessage()
                )));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(WebExchangeBindException ex) {
        Map<String, String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null ?
                                fieldError.getDefaultMessage() : "Invalid value",
                        (first, second) -> first
                ));

        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации данных",
                        "status", 400,
                        "details", errors
                )));
    }
}
