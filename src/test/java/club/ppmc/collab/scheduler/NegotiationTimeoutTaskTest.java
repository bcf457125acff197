package club.ppmc.collab.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.collab.config.CollabProperties;
import club.ppmc.collab.model.NegotiationPhase;
import club.ppmc.collab.model.NegotiationSession;
import club.ppmc.collab.service.CallNegotiationService;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class NegotiationTimeoutTaskTest {

    private final CallNegotiationService negotiation = mock(CallNegotiationService.class);

    @Test
    void disabledTimeoutNeverSweeps() {
        var task = new NegotiationTimeoutTask(negotiation, properties(Duration.ZERO));

        assertThat(task.expireUnansweredOffers()).isZero();
        verify(negotiation, never()).expireStaleOffers(any());
    }

    @Test
    void enabledTimeoutExpiresStaleOffers() {
        var expired = new NegotiationSession("r1", "a", "b", NegotiationPhase.TORN_DOWN, Instant.EPOCH);
        when(negotiation.expireStaleOffers(Duration.ofSeconds(30))).thenReturn(List.of(expired));
        var task = new NegotiationTimeoutTask(negotiation, properties(Duration.ofSeconds(30)));

        assertThat(task.expireUnansweredOffers()).isEqualTo(1);
    }

    @Test
    void failingSweepDoesNotPropagate() {
        when(negotiation.expireStaleOffers(any())).thenThrow(new IllegalStateException("boom"));
        var task = new NegotiationTimeoutTask(negotiation, properties(Duration.ofSeconds(5)));

        task.sweep();

        assertThat(task.expireUnansweredOffers()).isZero();
    }

    private static CollabProperties properties(Duration timeout) {
        return new CollabProperties(new CollabProperties.Relay(false), new CollabProperties.Negotiation(timeout));
    }
}
