package ru.oparin.recovery.util;

import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SecureTokenUtilTest {

    private final SecureRandom random = new SecureRandom();

    @Test
    void generated_token_is_url_safe_and_unpadded() {
        String token = SecureTokenUtil.generate(random, 32);

        assertEquals(43, token.length());
        assertTrue(token.matches("[A-Za-z0-9_-]+"));
        assertTrue(SecureTokenUtil.isWellFormed(token));
    }

    @Test
    void tokens_do_not_repeat() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            tokens.add(SecureTokenUtil.generate(random, 32));
        }
        assertEquals(1000, tokens.size());
    }

    @Test
    void too_short_token_is_refused() {
        assertThrows(IllegalArgumentException.class, () -> SecureTokenUtil.generate(random, 8));
    }

    @Test
    void garbage_is_not_well_formed() {
        assertFalse(SecureTokenUtil.isWellFormed(null));
        assertFalse(SecureTokenUtil.isWellFormed(""));
        assertFalse(SecureTokenUtil.isWellFormed("short"));
        assertFalse(SecureTokenUtil.isWellFormed("abc def ghi jkl mno pqr stu"));
        assertFalse(SecureTokenUtil.isWellFormed("dGVzdC10b2tlbi1mb3ItcGFzc3dvcmQtcmVzZXQ=="));
    }

    @Test
    void comparison_and_mask() {
        assertTrue(SecureTokenUtil.constantTimeEquals("abcdef", "abcdef"));
        assertFalse(SecureTokenUtil.constantTimeEquals("abcdef", "abcdeg"));
        assertFalse(SecureTokenUtil.constantTimeEquals(null, "abcdef"));
        assertEquals("abcdef***", SecureTokenUtil.mask("abcdefghijklmnop"));
        assertEquals("***", SecureTokenUtil.mask("abc"));
    }
}
