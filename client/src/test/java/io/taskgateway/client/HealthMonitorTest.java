package io.taskgateway.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.taskgateway.client.transport.UpstreamClient;
import io.taskgateway.client.transport.UpstreamConnectException;
import io.taskgateway.client.transport.UpstreamRequest;
import io.taskgateway.client.transport.UpstreamResponse;
import io.taskgateway.core.model.HttpMethod;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HealthMonitorTest {

    private static final Duration TTL = Duration.ofSeconds(60);

    @Mock
    private UpstreamClient client;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new HealthMonitor(client, "/health", TTL, clock);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static UpstreamResponse status(int code) {
        return new UpstreamResponse(code, Map.of(), "");
    }

    @Test
    void checksTheHealthPathWithGet() throws Exception {
        when(client.send(any())).thenReturn(status(200));

        assertThat(monitor.isHealthy()).isTrue();

        ArgumentCaptor<UpstreamRequest> captor = ArgumentCaptor.forClass(UpstreamRequest.class);
        verify(client).send(captor.capture());
        assertThat(captor.getValue().method()).isEqualTo(HttpMethod.GET);
        assertThat(captor.getValue().path()).isEqualTo("/health");
    }

    @Test
    void healthyVerdictIsCachedUntilTtlExpires() throws Exception {
        when(client.send(any())).thenReturn(status(200));

        assertThat(monitor.isHealthy()).isTrue();
        clock.advance(TTL.minusSeconds(1));
        assertThat(monitor.isHealthy()).isTrue();
        verify(client, times(1)).send(any());

        clock.advance(Duration.ofSeconds(1));
        assertThat(monitor.isHealthy()).isTrue();
        verify(client, times(2)).send(any());
    }

    @Test
    void unhealthyVerdictIsNeverCached() throws Exception {
        when(client.send(any())).thenReturn(status(503), status(200));

        assertThat(monitor.isHealthy()).isFalse();
        assertThat(monitor.isHealthy()).isTrue();
        verify(client, times(2)).send(any());
    }

    @Test
    void transportFailureIsUnhealthyAndDropsCache() throws Exception {
        when(client.send(any()))
                .thenReturn(status(204))
                .thenThrow(new UpstreamConnectException("Connection refused", null));

        assertThat(monitor.isHealthy()).isTrue();
        clock.advance(TTL);
        assertThat(monitor.isHealthy()).isFalse();
        assertThat(monitor.isHealthy()).isFalse();
        verify(client, times(3)).send(any());
    }

    @Test
    void interruptionIsUnhealthyAndKeepsTheFlag() throws Exception {
        when(client.send(any())).thenThrow(new InterruptedException("stop"));

        assertThat(monitor.isHealthy()).isFalse();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    /** Clock whose instant only moves when told to. */
    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
