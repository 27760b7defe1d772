package ru.oparin.recovery.exception;

/**
 * Хранилище токенов недоступно или не ответило за отведенное время.
 * Временная ошибка: вызывающий может повторить запрос позже.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
