package ru.oparin.recovery.util;

import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IpUtilTest {

    @Test
    void first_forwarded_address_wins() {
        MockServerHttpRequest request = MockServerHttpRequest.post("/api/password-reset/request")
                .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                .header("X-Real-IP", "10.0.0.1")
                .build();

        assertEquals("203.0.113.7", IpUtil.extractClientIp(request));
    }

    @Test
    void real_ip_header_is_used_without_forwarded_for() {
        MockServerHttpRequest request = MockServerHttpRequest.post("/api/password-reset/request")
                .header("X-Real-IP", "198.51.100.2")
                .build();

        assertEquals("198.51.100.2", IpUtil.extractClientIp(request));
    }

    @Test
    void remote_address_is_the_fallback() {
        MockServerHttpRequest request = MockServerHttpRequest.post("/api/password-reset/request")
                .remoteAddress(new InetSocketAddress("192.0.2.10", 54321))
                .build();

        assertEquals("192.0.2.10", IpUtil.extractClientIp(request));
    }
}
