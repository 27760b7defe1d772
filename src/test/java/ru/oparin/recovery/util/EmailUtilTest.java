package ru.oparin.recovery.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmailUtilTest {

    @Test
    void normalize_trims_and_lowercases() {
        assertEquals("ivan@mail.ru", EmailUtil.normalize("  Ivan@Mail.RU "));
        assertNull(EmailUtil.normalize(null));
    }

    @Test
    void validation() {
        assertTrue(EmailUtil.isValid("ivan@mail.ru"));
        assertFalse(EmailUtil.isValid("ivan@mail"));
        assertFalse(EmailUtil.isValid("ivan mail.ru"));
        assertFalse(EmailUtil.isValid(null));
    }

    @Test
    void mask_hides_local_part() {
        assertEquals("i***@mail.ru", EmailUtil.mask("ivan@mail.ru"));
        assertEquals("***", EmailUtil.mask("nomail"));
    }
}
