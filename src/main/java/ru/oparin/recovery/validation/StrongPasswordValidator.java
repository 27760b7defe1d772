package ru.oparin.recovery.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

public class StrongPasswordValidator implements ConstraintValidator<StrongPassword, String> {

    static final int MIN_LENGTH = 8;
    static final int MAX_LENGTH = 128;

    private static final Pattern LETTER = Pattern.compile("\\p{L}");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern WHITESPACE_ONLY = Pattern.compile("^\\s*$");

    @Override
    public boolean isValid(String password, ConstraintValidatorContext context) {
        if (password == null || WHITESPACE_ONLY.matcher(password).matches()) {
            return false;
        }

        if (password.length() < MIN_LENGTH) {
            return reject(context, "Пароль должен содержать минимум " + MIN_LENGTH + " символов");
        }

        if (password.length() > MAX_LENGTH) {
            return reject(context, "Пароль должен содержать не более " + MAX_LENGTH + " символов");
        }

        if (!LETTER.matcher(password).find()) {
            return reject(context, "Пароль должен содержать буквы");
        }

        if (!DIGIT.matcher(password).find()) {
            return reject(context, "Пароль должен содержать цифры");
        }

        return true;
    }

    private boolean reject(ConstraintValidatorContext context, String message) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message)
                .addConstraintViolation();
        return false;
    }
}
