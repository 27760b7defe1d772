package ru.oparin.recovery.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import ru.oparin.recovery.model.dto.reset.ResetPasswordRequest;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StrongPasswordValidatorTest {

    private static final String TOKEN = "dGVzdC10b2tlbi1mb3ItcGFzc3dvcmQtdmFsaWRhdG9y";

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void letters_and_digits_pass() {
        assertTrue(validate("newPassw0rd").isEmpty());
        assertTrue(validate("пароль2026").isEmpty());
    }

    @Test
    void short_password_fails_with_length_message() {
        assertEquals("Пароль должен содержать минимум 8 символов", singleMessage("abc123"));
    }

    @Test
    void password_without_digits_fails() {
        assertEquals("Пароль должен содержать цифры", singleMessage("onlyletters"));
    }

    @Test
    void password_without_letters_fails() {
        assertEquals("Пароль должен содержать буквы", singleMessage("1234567890"));
    }

    @Test
    void too_long_password_fails() {
        assertEquals("Пароль должен содержать не более 128 символов", singleMessage("a1".repeat(65)));
    }

    private Set<ConstraintViolation<ResetPasswordRequest>> validate(String password) {
        return validator.validate(new ResetPasswordRequest(TOKEN, password));
    }

    private String singleMessage(String password) {
        Set<ConstraintViolation<ResetPasswordRequest>> violations = validate(password);
        assertEquals(1, violations.size());
        return violations.iterator().next().getMessage();
    }
}
