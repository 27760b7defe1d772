package ru.oparin.recovery.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.oparin.recovery.model.enums.DeliveryChannel;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Реестр доступных каналов доставки. Набор каналов зависит от конфигурации процесса.
 */
@Slf4j
@Component
public class NotificationChannelRegistry {

    private final Map<DeliveryChannel, NotificationChannel> channels = new EnumMap<>(DeliveryChannel.class);

    public NotificationChannelRegistry(List<NotificationChannel> notificationChannels) {
        for (NotificationChannel channel : notificationChannels) {
            channels.put(channel.getChannel(), channel);
        }
        log.info("Доступные каналы доставки: {}", channels.keySet());
    }

    public Optional<NotificationChannel> find(DeliveryChannel channel) {
        return Optional.ofNullable(channels.get(channel));
    }
}
