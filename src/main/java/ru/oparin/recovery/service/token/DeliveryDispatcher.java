package ru.oparin.recovery.service.token;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.config.properties.DeliveryProperties;
import ru.oparin.recovery.model.dto.reset.DeliveryReport;
import ru.oparin.recovery.model.entity.ResetToken;
import ru.oparin.recovery.model.enums.DeliveryMarkResult;
import ru.oparin.recovery.model.enums.DeliveryResult;
import ru.oparin.recovery.service.notification.NotificationChannel;
import ru.oparin.recovery.service.notification.NotificationChannelRegistry;
import ru.oparin.recovery.service.notification.ResetMessageBuilder;
import ru.oparin.recovery.util.SecureTokenUtil;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Доставка ссылок для сброса пароля.
 * <p>
 * Один цикл: взять пачку PENDING токенов, по очереди захватить каждый условным UPDATE,
 * отправить через канал и только после подтверждения канала перевести в DELIVERED.
 * Токен, который захватил другой экземпляр воркера или который не удалось захватить
 * из-за ошибки хранилища, пропускается. Отправка ограничена временем короче захвата,
 * поэтому захват не истекает, пока владелец еще отправляет.
 * <p>
 * Временная ошибка канала увеличивает счетчик попыток и снимает захват, токен будет
 * повторен в следующем цикле. После исчерпания попыток или при постоянной ошибке токен
 * остается PENDING до истечения срока и виден оператору.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryDispatcher {

    private final ResetTokenStore tokenStore;
    private final NotificationChannelRegistry channelRegistry;
    private final ResetMessageBuilder messageBuilder;
    private final DeliveryProperties deliveryProperties;
    private final Clock clock;

    /**
     * Выполнить один цикл доставки.
     *
     * @return итоги цикла
     */
    public Mono<DeliveryReport> dispatchBatch() {
        DeliveryReport report = new DeliveryReport();

        return tokenStore.fetchPending(deliveryProperties.getBatchSize(), deliveryProperties.getMaxAttempts(), now())
                .collectList()
                .flatMap(tokens -> {
                    report.fetched(tokens.size());
                    return Flux.fromIterable(tokens)
                            .concatMap(token -> deliver(token, report))
                            .then(Mono.just(report));
                });
    }

    /**
     * Доставить один токен: захват, отправка, фиксация результата.
     */
    Mono<Void> deliver(ResetToken token, DeliveryReport report) {
        String workerId = deliveryProperties.getWorkerId();
        String masked = SecureTokenUtil.mask(token.getId());

        return tokenStore.claimForDelivery(token.getId(), workerId, now(), deliveryProperties.getClaimTimeout())
                .onErrorResume(error -> {
                    log.warn("Не удалось захватить токен {}, пропускаем до следующего цикла: {}", masked, error.getMessage());
                    report.skipped();
                    return Mono.empty();
                })
                .flatMap(claimed -> {
                    if (!claimed) {
                        log.debug("Токен {} уже захвачен другим воркером, пропускаем", masked);
                        report.skipped();
                        return Mono.empty();
                    }
                    report.claimed();
                    return send(token)
                            .flatMap(result -> applyResult(token, result, report))
                            .onErrorResume(error -> releaseAfterError(token, workerId, report, error));
                })
                .then();
    }

    private Mono<Void> releaseAfterError(ResetToken token, String workerId, DeliveryReport report, Throwable error) {
        String masked = SecureTokenUtil.mask(token.getId());
        log.error("Ошибка доставки токена {} аккаунта {}", masked, token.getAccountRef(), error);
        report.retried();
        return tokenStore.recordDeliveryFailure(token.getId(), workerId, false, error.getMessage())
                .onErrorResume(e -> {
                    log.error("Не удалось снять захват токена {}, он освободится по таймауту: {}", masked, e.getMessage());
                    return Mono.just(false);
                })
                .then();
    }

    private Mono<DeliveryResult> send(ResetToken token) {
        Optional<NotificationChannel> channel = channelRegistry.find(token.getChannel());
        if (channel.isEmpty()) {
            log.warn("Канал {} не настроен в этом процессе, токен {} будет повторен позже",
                    token.getChannel(), SecureTokenUtil.mask(token.getId()));
            return Mono.just(DeliveryResult.TRANSIENT_FAILURE);
        }

        String link = messageBuilder.buildResetLink(token.getId());
        return channel.get().send(token.getContact(), link)
                .timeout(deliveryProperties.effectiveSendTimeout())
                .defaultIfEmpty(DeliveryResult.TRANSIENT_FAILURE)
                .onErrorResume(error -> {
                    log.warn("Канал {} завершился исключением: {}", token.getChannel(), error.getMessage());
                    return Mono.just(DeliveryResult.TRANSIENT_FAILURE);
                });
    }

    private Mono<Void> applyResult(ResetToken token, DeliveryResult result, DeliveryReport report) {
        String masked = SecureTokenUtil.mask(token.getId());
        String workerId = deliveryProperties.getWorkerId();

        switch (result) {
            case OK:
                return tokenStore.markDelivered(token.getId(), now())
                        .doOnNext(mark -> {
                            if (mark == DeliveryMarkResult.MARKED) {
                                report.delivered();
                                log.info("Ссылка по токену {} доставлена через {} (аккаунт {})",
                                        masked, token.getChannel(), token.getAccountRef());
                            } else {
                                log.warn("Токен {} отправлен, но не переведен в DELIVERED: {}", masked, mark);
                            }
                        })
                        .then();
            case PERMANENT_FAILURE:
                report.failed();
                log.warn("Доставка токена {} через {} невозможна, токен остается PENDING до истечения срока",
                        masked, token.getChannel());
                return tokenStore.recordDeliveryFailure(token.getId(), workerId, true, "permanent failure: " + token.getChannel())
                        .then();
            default:
                report.retried();
                int attempt = token.getDeliveryAttempts() + 1;
                if (attempt >= deliveryProperties.getMaxAttempts()) {
                    log.warn("Токен {}: исчерпаны попытки доставки ({}), оставлен PENDING для ручного разбора",
                            masked, attempt);
                } else {
                    log.info("Токен {}: временная ошибка доставки, попытка {} из {}",
                            masked, attempt, deliveryProperties.getMaxAttempts());
                }
                return tokenStore.recordDeliveryFailure(token.getId(), workerId, false, "transient failure: " + token.getChannel())
                        .then();
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
