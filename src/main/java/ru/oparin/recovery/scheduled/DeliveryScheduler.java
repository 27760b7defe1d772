package ru.oparin.recovery.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.oparin.recovery.model.dto.reset.DeliveryReport;
import ru.oparin.recovery.service.token.DeliveryDispatcher;

/**
 * Воркер доставки ссылок для сброса пароля.
 * <p>
 * fixedDelay и блокирующее ожидание цикла: следующий опрос начинается только после
 * завершения предыдущего, циклы одного процесса не пересекаются.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.delivery.enabled", havingValue = "true")
public class DeliveryScheduler {

    private final DeliveryDispatcher deliveryDispatcher;

    @Scheduled(fixedDelayString = "${app.delivery.poll-interval-ms:3000}")
    public void poll() {
        try {
            DeliveryReport report = deliveryDispatcher.dispatchBatch().block();
            if (report != null && report.getFetched() > 0) {
                log.info("Цикл доставки завершен: {}", report);
            }
        } catch (Exception e) {
            log.error("Ошибка в цикле доставки ссылок", e);
        }
    }
}
