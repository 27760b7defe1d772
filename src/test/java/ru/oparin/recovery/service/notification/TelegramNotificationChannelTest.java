package ru.oparin.recovery.service.notification;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.recovery.config.properties.ResetProperties;
import ru.oparin.recovery.model.enums.DeliveryResult;
import ru.oparin.recovery.service.telegram.TelegramMessageService;

import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelegramNotificationChannelTest {

    private static final String LINK = "https://recovery.test/reset-password?token=abc_def";

    @Mock TelegramMessageService telegramMessageService;

    @Test
    void link_is_sent_to_linked_chat() {
        TelegramNotificationChannel channel = newChannel();
        when(telegramMessageService.sendPlainMessage(eq(555L), contains(LINK))).thenReturn(Mono.just(DeliveryResult.OK));

        StepVerifier.create(channel.send("555", LINK))
                .expectNext(DeliveryResult.OK)
                .verifyComplete();
    }

    @Test
    void non_numeric_chat_id_is_permanent() {
        TelegramNotificationChannel channel = newChannel();

        StepVerifier.create(channel.send("@username", LINK))
                .expectNext(DeliveryResult.PERMANENT_FAILURE)
                .verifyComplete();

        verifyNoInteractions(telegramMessageService);
    }

    private TelegramNotificationChannel newChannel() {
        return new TelegramNotificationChannel(telegramMessageService, new ResetMessageBuilder(new ResetProperties()));
    }
}
