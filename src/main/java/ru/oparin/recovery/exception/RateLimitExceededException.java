package ru.oparin.recovery.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

public class RateLimitExceededException extends RuntimeException {
    @Getter
    private final HttpStatus status = HttpStatus.TOO_MANY_REQUESTS;

    public RateLimitExceededException(String message) {
        super(message);
    }
}
