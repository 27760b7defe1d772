package ru.oparin.recovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Точка входа. Одно и то же приложение запускается в двух ролях:
 * профиль {@code web} обслуживает HTTP-запросы на сброс пароля,
 * профиль {@code worker} доставляет ссылки и принимает команды Telegram бота.
 */
@EnableR2dbcRepositories(basePackages = "ru.oparin.recovery.repository")
@EnableScheduling
@SpringBootApplication
public class RecoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecoveryApplication.class, args);
    }
}
