package ru.oparin.recovery.service.token;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.recovery.config.properties.DeliveryProperties;
import ru.oparin.recovery.config.properties.ResetProperties;
import ru.oparin.recovery.exception.StoreUnavailableException;
import ru.oparin.recovery.model.entity.ResetToken;
import ru.oparin.recovery.model.enums.DeliveryChannel;
import ru.oparin.recovery.model.enums.DeliveryMarkResult;
import ru.oparin.recovery.model.enums.DeliveryResult;
import ru.oparin.recovery.model.enums.ResetTokenState;
import ru.oparin.recovery.service.notification.NotificationChannel;
import ru.oparin.recovery.service.notification.NotificationChannelRegistry;
import ru.oparin.recovery.service.notification.ResetMessageBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeliveryDispatcherTest {

    private static final String WORKER = "test-worker";
    private static final String TOKEN_ID = "dGVzdC10b2tlbi1mb3ItZGVsaXZlcnktZGlzcGF0Y2g";

    @Mock ResetTokenStore tokenStore;
    @Mock NotificationChannel emailChannel;

    DeliveryProperties deliveryProperties;
    DeliveryDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        when(emailChannel.getChannel()).thenReturn(DeliveryChannel.EMAIL);

        deliveryProperties = new DeliveryProperties();
        deliveryProperties.setWorkerId(WORKER);

        ResetProperties resetProperties = new ResetProperties();
        resetProperties.setFrontendUrl("https://recovery.test/");

        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        dispatcher = new DeliveryDispatcher(tokenStore, new NotificationChannelRegistry(List.of(emailChannel)),
                new ResetMessageBuilder(resetProperties), deliveryProperties, clock);
    }

    @Test
    void delivered_token_is_marked_after_channel_confirms() {
        ResetToken token = pendingToken(DeliveryChannel.EMAIL, "user@example.com");
        givenPending(token);
        when(tokenStore.claimForDelivery(eq(TOKEN_ID), eq(WORKER), any(LocalDateTime.class), any()))
                .thenReturn(Mono.just(true));
        when(emailChannel.send("user@example.com", "https://recovery.test/reset-password?token=" + TOKEN_ID))
                .thenReturn(Mono.just(DeliveryResult.OK));
        when(tokenStore.markDelivered(eq(TOKEN_ID), any(LocalDateTime.class)))
                .thenReturn(Mono.just(DeliveryMarkResult.MARKED));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> {
                    assertEquals(1, report.getFetched());
                    assertEquals(1, report.getClaimed());
                    assertEquals(1, report.getDelivered());
                    assertEquals(0, report.getRetried());
                })
                .verifyComplete();

        verify(tokenStore, never()).recordDeliveryFailure(anyString(), anyString(), anyBoolean(), anyString());
    }

    @Test
    void token_claimed_elsewhere_is_skipped_without_sending() {
        givenPending(pendingToken(DeliveryChannel.EMAIL, "user@example.com"));
        when(tokenStore.claimForDelivery(eq(TOKEN_ID), eq(WORKER), any(LocalDateTime.class), any()))
                .thenReturn(Mono.just(false));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> {
                    assertEquals(1, report.getSkipped());
                    assertEquals(0, report.getClaimed());
                })
                .verifyComplete();

        verify(emailChannel, never()).send(anyString(), anyString());
        verify(tokenStore, never()).markDelivered(anyString(), any(LocalDateTime.class));
    }

    @Test
    void transient_failure_counts_attempt_and_keeps_token_pending() {
        givenClaimedToken(DeliveryChannel.EMAIL, "user@example.com");
        when(emailChannel.send(anyString(), anyString())).thenReturn(Mono.just(DeliveryResult.TRANSIENT_FAILURE));
        when(tokenStore.recordDeliveryFailure(eq(TOKEN_ID), eq(WORKER), eq(false), anyString()))
                .thenReturn(Mono.just(true));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> assertEquals(1, report.getRetried()))
                .verifyComplete();

        verify(tokenStore, never()).markDelivered(anyString(), any(LocalDateTime.class));
    }

    @Test
    void permanent_failure_marks_token_undeliverable() {
        givenClaimedToken(DeliveryChannel.EMAIL, "broken-address");
        when(emailChannel.send(anyString(), anyString())).thenReturn(Mono.just(DeliveryResult.PERMANENT_FAILURE));
        when(tokenStore.recordDeliveryFailure(eq(TOKEN_ID), eq(WORKER), eq(true), anyString()))
                .thenReturn(Mono.just(true));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> {
                    assertEquals(1, report.getFailed());
                    assertEquals(0, report.getDelivered());
                })
                .verifyComplete();
    }

    @Test
    void channel_exception_is_treated_as_transient() {
        givenClaimedToken(DeliveryChannel.EMAIL, "user@example.com");
        when(emailChannel.send(anyString(), anyString())).thenReturn(Mono.error(new IllegalStateException("smtp down")));
        when(tokenStore.recordDeliveryFailure(eq(TOKEN_ID), eq(WORKER), eq(false), anyString()))
                .thenReturn(Mono.just(true));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> assertEquals(1, report.getRetried()))
                .verifyComplete();
    }

    @Test
    void unconfigured_channel_is_retried_later() {
        givenClaimedToken(DeliveryChannel.TELEGRAM, "100500");
        when(tokenStore.recordDeliveryFailure(eq(TOKEN_ID), eq(WORKER), eq(false), anyString()))
                .thenReturn(Mono.just(true));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> assertEquals(1, report.getRetried()))
                .verifyComplete();

        verify(emailChannel, never()).send(anyString(), anyString());
    }

    @Test
    void already_delivered_token_is_not_counted_twice() {
        givenClaimedToken(DeliveryChannel.EMAIL, "user@example.com");
        when(emailChannel.send(anyString(), anyString())).thenReturn(Mono.just(DeliveryResult.OK));
        when(tokenStore.markDelivered(eq(TOKEN_ID), any(LocalDateTime.class)))
                .thenReturn(Mono.just(DeliveryMarkResult.ALREADY_DELIVERED));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> assertEquals(0, report.getDelivered()))
                .verifyComplete();
    }

    @Test
    void store_failure_during_mark_releases_claim() {
        givenClaimedToken(DeliveryChannel.EMAIL, "user@example.com");
        when(emailChannel.send(anyString(), anyString())).thenReturn(Mono.just(DeliveryResult.OK));
        when(tokenStore.markDelivered(eq(TOKEN_ID), any(LocalDateTime.class)))
                .thenReturn(Mono.error(new IllegalStateException("connection reset")));
        when(tokenStore.recordDeliveryFailure(eq(TOKEN_ID), eq(WORKER), eq(false), anyString()))
                .thenReturn(Mono.just(true));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> assertEquals(1, report.getRetried()))
                .verifyComplete();
    }

    @Test
    void claim_error_is_skipped_without_touching_token() {
        givenPending(pendingToken(DeliveryChannel.EMAIL, "user@example.com"));
        when(tokenStore.claimForDelivery(eq(TOKEN_ID), eq(WORKER), any(LocalDateTime.class), any()))
                .thenReturn(Mono.error(new StoreUnavailableException("Хранилище токенов недоступно",
                        new IllegalStateException("connection reset"))));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> {
                    assertEquals(1, report.getSkipped());
                    assertEquals(0, report.getClaimed());
                    assertEquals(0, report.getRetried());
                })
                .verifyComplete();

        verify(emailChannel, never()).send(anyString(), anyString());
        verify(tokenStore, never()).recordDeliveryFailure(anyString(), anyString(), anyBoolean(), anyString());
    }

    @Test
    void hanging_channel_is_cut_off_and_retried() {
        deliveryProperties.setSendTimeout(Duration.ofMillis(50));
        givenClaimedToken(DeliveryChannel.EMAIL, "user@example.com");
        when(emailChannel.send(anyString(), anyString())).thenReturn(Mono.never());
        when(tokenStore.recordDeliveryFailure(eq(TOKEN_ID), eq(WORKER), eq(false), anyString()))
                .thenReturn(Mono.just(true));

        StepVerifier.create(dispatcher.dispatchBatch())
                .assertNext(report -> {
                    assertEquals(1, report.getRetried());
                    assertEquals(0, report.getDelivered());
                })
                .verifyComplete();

        verify(tokenStore, never()).markDelivered(anyString(), any(LocalDateTime.class));
    }

    @Test
    void send_timeout_never_outlives_claim() {
        DeliveryProperties properties = new DeliveryProperties();
        assertEquals(Duration.ofSeconds(45), properties.effectiveSendTimeout());

        properties.setClaimTimeout(Duration.ofSeconds(30));
        assertEquals(Duration.ofSeconds(15), properties.effectiveSendTimeout());
    }

    private void givenPending(ResetToken token) {
        when(tokenStore.fetchPending(eq(20), eq(5), any(LocalDateTime.class))).thenReturn(Flux.just(token));
    }

    private void givenClaimedToken(DeliveryChannel channel, String contact) {
        givenPending(pendingToken(channel, contact));
        when(tokenStore.claimForDelivery(eq(TOKEN_ID), eq(WORKER), any(LocalDateTime.class), any()))
                .thenReturn(Mono.just(true));
    }

    private static ResetToken pendingToken(DeliveryChannel channel, String contact) {
        LocalDateTime createdAt = LocalDateTime.of(2026, 1, 15, 9, 55);
        return ResetToken.builder()
                .id(TOKEN_ID)
                .accountRef("42")
                .activeAccountRef("42")
                .state(ResetTokenState.PENDING)
                .channel(channel)
                .contact(contact)
                .createdAt(createdAt)
                .expiresAt(createdAt.plusMinutes(30))
                .build();
    }
}
