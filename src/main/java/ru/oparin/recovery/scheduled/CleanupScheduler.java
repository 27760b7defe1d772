package ru.oparin.recovery.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.oparin.recovery.config.properties.CleanupProperties;
import ru.oparin.recovery.service.token.ResetTokenStore;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Планировщик задач очистки токенов
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.cleanup.enabled", havingValue = "true")
public class CleanupScheduler {

    private final ResetTokenStore tokenStore;
    private final CleanupProperties cleanupProperties;
    private final Clock clock;

    /**
     * Перевод просроченных активных токенов в EXPIRED.
     * Погашение проверяет срок само, здесь только приводится в порядок состояние в таблице.
     */
    @Scheduled(fixedDelayString = "${app.cleanup.sweep-interval-ms:60000}")
    public void sweepExpiredTokens() {
        try {
            Integer expired = tokenStore.markExpiredSweep(LocalDateTime.now(clock)).block();
            if (expired != null && expired > 0) {
                log.info("Переведено в EXPIRED просроченных токенов: {}", expired);
            }
        } catch (Exception e) {
            log.error("Ошибка при переводе просроченных токенов", e);
        }
    }

    /**
     * Удаление закрытых токенов старше срока хранения каждый день в 02:00
     */
    @Scheduled(cron = "0 0 2 * * ?")
    public void purgeClosedTokens() {
        log.info("Очистка закрытых токенов сброса пароля...");

        try {
            LocalDateTime before = LocalDateTime.now(clock).minus(cleanupProperties.getRetention());
            Integer deleted = tokenStore.purgeClosed(before).block();
            log.info("Очистка токенов завершена. Удалено: {} токенов, закрытых до {}", deleted, before);
        } catch (Exception e) {
            log.error("Ошибка при очистке токенов", e);
        }
    }
}
