package ru.oparin.recovery.scheduled;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import ru.oparin.recovery.exception.StoreUnavailableException;
import ru.oparin.recovery.model.dto.reset.DeliveryReport;
import ru.oparin.recovery.service.token.DeliveryDispatcher;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeliverySchedulerTest {

    @Mock DeliveryDispatcher deliveryDispatcher;

    @Test
    void each_poll_runs_one_cycle() {
        when(deliveryDispatcher.dispatchBatch()).thenReturn(Mono.just(new DeliveryReport().fetched(0)));
        DeliveryScheduler scheduler = new DeliveryScheduler(deliveryDispatcher);

        scheduler.poll();
        scheduler.poll();

        verify(deliveryDispatcher, times(2)).dispatchBatch();
    }

    @Test
    void store_outage_is_logged_and_next_poll_continues() {
        when(deliveryDispatcher.dispatchBatch())
                .thenReturn(Mono.error(new StoreUnavailableException("Хранилище токенов недоступно", null)));
        DeliveryScheduler scheduler = new DeliveryScheduler(deliveryDispatcher);

        assertDoesNotThrow(scheduler::poll);
    }
}
