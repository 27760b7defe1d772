package ru.oparin.recovery.service.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.recovery.model.enums.DeliveryChannel;
import ru.oparin.recovery.model.enums.DeliveryResult;
import ru.oparin.recovery.util.EmailUtil;

/**
 * Доставка ссылки письмом через SMTP.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "spring.mail.host")
public class EmailNotificationChannel implements NotificationChannel {

    private final JavaMailSender mailSender;
    private final ResetMessageBuilder messageBuilder;

    @Value("${app.email.from:noreply@localhost}")
    private String fromEmail;

    @Override
    public DeliveryChannel getChannel() {
        return DeliveryChannel.EMAIL;
    }

    @Override
    public Mono<DeliveryResult> send(String contact, String resetLink) {
        return Mono.fromCallable(() -> {
                    SimpleMailMessage message = new SimpleMailMessage();
                    message.setFrom(fromEmail);
                    message.setTo(contact);
                    message.setSubject(messageBuilder.buildEmailSubject());
                    message.setText(messageBuilder.buildEmailContent(resetLink));

                    log.info("Отправляем email на: {}", EmailUtil.mask(contact));
                    mailSender.send(message);
                    log.info("Письмо со ссылкой для сброса пароля отправлено на: {}", EmailUtil.mask(contact));
                    return DeliveryResult.OK;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(MailException.class, e -> {
                    DeliveryResult result = classify(e);
                    log.error("Ошибка при отправке email на {} ({}): {}", EmailUtil.mask(contact), result, e.getMessage());
                    return Mono.just(result);
                });
    }

    /**
     * Ошибки авторизации, разбора и подготовки письма (неверный адрес) без вмешательства
     * не исправятся, повторять бесполезно. Остальное (SMTP недоступен, обрыв соединения) временное.
     */
    static DeliveryResult classify(MailException e) {
        if (e instanceof MailAuthenticationException
                || e instanceof MailParseException
                || e instanceof MailPreparationException) {
            return DeliveryResult.PERMANENT_FAILURE;
        }
        return DeliveryResult.TRANSIENT_FAILURE;
    }
}
