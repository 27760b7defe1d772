package ru.oparin.recovery.model.dto.reset;

import lombok.Value;
import ru.oparin.recovery.model.enums.DeliveryChannel;

/**
 * Куда доставить ссылку: канал и адрес в нем.
 */
@Value
public class DeliveryTarget {
    DeliveryChannel channel;
    String contact;
}
