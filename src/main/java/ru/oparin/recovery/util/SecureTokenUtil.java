package ru.oparin.recovery.util;

import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Генерация и проверка формата секретных токенов для ссылок сброса пароля.
 */
@UtilityClass
public class SecureTokenUtil {

    /**
     * Минимум 16 байт = 128 бит энтропии.
     */
    public static final int MIN_TOKEN_BYTES = 16;

    private static final Pattern URL_SAFE_BASE64 = Pattern.compile("^[A-Za-z0-9_-]{22,256}$");

    public static String generate(SecureRandom random, int tokenBytes) {
        if (tokenBytes < MIN_TOKEN_BYTES) {
            throw new IllegalArgumentException("Токен должен содержать не менее " + MIN_TOKEN_BYTES + " байт");
        }
        byte[] bytes = new byte[tokenBytes];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Проверить, похожа ли строка на выпущенный нами токен. Мусор отсекается без запроса в базу.
     */
    public static boolean isWellFormed(String token) {
        return token != null && URL_SAFE_BASE64.matcher(token).matches();
    }

    /**
     * Сравнение за постоянное время, не зависящее от позиции первого несовпадения.
     */
    public static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Короткий префикс токена для логов. Полное значение в логи не пишется.
     */
    public static String mask(String token) {
        if (token == null || token.length() < 6) {
            return "***";
        }
        return token.substring(0, 6) + "***";
    }
}
