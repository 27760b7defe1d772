package ru.oparin.recovery.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpRequest;

import java.net.InetSocketAddress;

/**
 * Утилита для работы с IP адресами в WebFlux.
 */
@Slf4j
@UtilityClass
public class IpUtil {

    public static final String UNKNOWN = "unknown";

    /**
     * Извлекает IP адрес клиента из запроса.
     * Учитывает заголовки X-Forwarded-For и X-Real-IP для работы за прокси.
     *
     * @param request входящий запрос
     * @return IP адрес клиента или {@link #UNKNOWN}, если определить не удалось
     */
    public static String extractClientIp(ServerHttpRequest request) {
        // X-Forwarded-For может содержать несколько IP через запятую, первый - реальный клиент
        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            String firstIp = forwardedFor.split(",")[0].trim();
            if (!firstIp.isEmpty()) {
                return firstIp;
            }
        }

        String realIp = request.getHeaders().getFirst("X-Real-IP");
        if (realIp != null && !realIp.isEmpty()) {
            return realIp;
        }

        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }

        log.warn("Не удалось определить IP адрес клиента. URI: {}", request.getURI());
        return UNKNOWN;
    }
}
