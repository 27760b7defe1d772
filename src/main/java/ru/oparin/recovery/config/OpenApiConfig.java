package ru.oparin.recovery.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

@OpenAPIDefinition(
        info = @Info(
                title = "Recovery API",
                version = "1.0.0",
                description = "Восстановление доступа к аккаунту по одноразовой ссылке",
                contact = @Contact(
                        name = "Support",
                        email = "support@oparin.ru"
                )
        ),
        servers = {
                @Server(url = "http://localhost:8080", description = "Локальный сервер")
        }
)
@Configuration
public class OpenApiConfig {
}
