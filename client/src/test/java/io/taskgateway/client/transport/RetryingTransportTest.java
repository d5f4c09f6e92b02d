package io.taskgateway.client.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.taskgateway.client.config.RetryConfig;
import io.taskgateway.core.error.GatewayError;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for the retry state machine of {@link RetryingTransport}. The
 * single-attempt client is mocked and sleeps are recorded, never slept.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RetryingTransport")
class RetryingTransportTest {

    private static final UpstreamRequest REQUEST = UpstreamRequest.get("tasks/");
    private static final RetryConfig RETRY = new RetryConfig(
            3, List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)));

    @Mock
    private UpstreamClient client;

    private final List<Duration> sleeps = new ArrayList<>();
    private final BackoffSleeper recordingSleeper = sleeps::add;

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private RetryingTransport transport(RetryConfig retry) {
        return new RetryingTransport(client, retry, recordingSleeper, Duration.ZERO);
    }

    private static UpstreamConnectException refused() {
        return new UpstreamConnectException("Connection refused", new ConnectException("refused"));
    }

    @Nested
    @DisplayName("retry bound")
    class RetryBound {

        @Test
        @DisplayName("maxRetries=3 and always refused → exactly 4 attempts, CONNECTION_FAILED")
        void fourAttemptsThenFailure() throws Exception {
            when(client.send(any(), isNull())).thenThrow(refused());

            TransportResult result = transport(RETRY).execute(REQUEST);

            verify(client, times(4)).send(any(), isNull());
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.attempts()).isEqualTo(4);
            assertThat(result.error().kind()).isEqualTo(GatewayError.Kind.CONNECTION_FAILED);
            assertThat(result.error().retryable()).isTrue();
            assertThat(result.error().cause()).isInstanceOf(UpstreamConnectException.class);
        }

        @Test
        @DisplayName("backoff follows the configured schedule between attempts")
        void backoffSchedule() throws Exception {
            when(client.send(any(), isNull())).thenThrow(refused());

            transport(RETRY).execute(REQUEST);

            assertThat(sleeps)
                    .containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
        }

        @Test
        @DisplayName("last backoff value is reused past the end of the list")
        void lastBackoffReused() throws Exception {
            when(client.send(any(), isNull())).thenThrow(refused());

            transport(new RetryConfig(4, List.of(Duration.ofMillis(10), Duration.ofMillis(20))))
                    .execute(REQUEST);

            assertThat(sleeps)
                    .containsExactly(
                            Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(20), Duration.ofMillis(20));
        }

        @Test
        @DisplayName("maxRetries=0 → single attempt, no sleep")
        void noRetries() throws Exception {
            when(client.send(any(), isNull())).thenThrow(new UpstreamTimeoutException("Request timeout", null));

            TransportResult result = transport(new RetryConfig(0, List.of(Duration.ofMillis(10)))).execute(REQUEST);

            verify(client, times(1)).send(any(), isNull());
            assertThat(sleeps).isEmpty();
            assertThat(result.error().kind()).isEqualTo(GatewayError.Kind.TIMEOUT);
        }
    }

    @Nested
    @DisplayName("no retry on HTTP responses")
    class NoRetryOnResponses {

        @Test
        @DisplayName("HTTP 500 with JSON body → exactly one attempt, returned as-is")
        void http500NotRetried() throws Exception {
            UpstreamResponse response = new UpstreamResponse(500, Map.of(), "{\"code\":500,\"message\":\"boom\"}");
            when(client.send(any(), isNull())).thenReturn(response);

            TransportResult result = transport(RETRY).execute(REQUEST);

            verify(client, times(1)).send(any(), isNull());
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.response()).isSameAs(response);
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("transient failure then success → success on attempt 2")
        void recoversAfterTransientFailure() throws Exception {
            UpstreamResponse ok = new UpstreamResponse(200, Map.of(), "[]");
            when(client.send(any(), isNull())).thenThrow(refused()).thenReturn(ok);

            TransportResult result = transport(RETRY).execute(REQUEST);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.attempts()).isEqualTo(2);
            assertThat(sleeps).containsExactly(Duration.ofMillis(100));
        }
    }

    @Nested
    @DisplayName("call deadline")
    class Deadline {

        @Test
        @DisplayName("retry that would start after the deadline is abandoned with TIMEOUT")
        void retryAbandonedAtDeadline() throws Exception {
            AtomicLong now = new AtomicLong();
            when(client.send(any(), any())).thenAnswer(invocation -> {
                now.addAndGet(Duration.ofMillis(150).toNanos());
                throw refused();
            });
            BackoffSleeper advancingSleeper = delay -> now.addAndGet(delay.toNanos());
            RetryingTransport transport =
                    new RetryingTransport(client, RETRY, advancingSleeper, Duration.ofMillis(500), now::get);

            TransportResult result = transport.execute(REQUEST);

            // t=150 fail, sleep 100 → t=250, attempt → t=400 fail, next sleep 200 would pass 500
            verify(client, times(2)).send(any(), any());
            assertThat(result.error().kind()).isEqualTo(GatewayError.Kind.TIMEOUT);
            assertThat(result.error().message()).contains("deadline");
            assertThat(result.attempts()).isEqualTo(2);
        }

        @Test
        @DisplayName("attempt timeout is capped by the time left")
        void attemptTimeoutCapped() throws Exception {
            AtomicLong now = new AtomicLong();
            UpstreamResponse ok = new UpstreamResponse(200, Map.of(), "{}");
            when(client.send(any(), any())).thenReturn(ok);
            RetryingTransport transport =
                    new RetryingTransport(client, RETRY, recordingSleeper, Duration.ofMillis(500), now::get);

            transport.execute(REQUEST);

            verify(client).send(REQUEST, Duration.ofMillis(500));
        }
    }

    @Test
    @DisplayName("interrupt during backoff → TIMEOUT and interrupt flag restored")
    void interruptDuringBackoff() throws Exception {
        when(client.send(any(), isNull())).thenThrow(refused());
        BackoffSleeper interrupted = delay -> {
            throw new InterruptedException("stop");
        };

        TransportResult result = new RetryingTransport(client, RETRY, interrupted, Duration.ZERO).execute(REQUEST);

        verify(client, times(1)).send(any(), isNull());
        assertThat(result.error().kind()).isEqualTo(GatewayError.Kind.TIMEOUT);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void timeoutIsClassifiedAsTimeout() {
        assertThat(RetryingTransport.classify(new UpstreamTimeoutException("Pool timeout", null)).kind())
                .isEqualTo(GatewayError.Kind.TIMEOUT);
        assertThat(RetryingTransport.classify(refused()).kind()).isEqualTo(GatewayError.Kind.CONNECTION_FAILED);
    }

    @Test
    void neverCallsClientWhenDeadlineAlreadyPassed() throws Exception {
        AtomicLong now = new AtomicLong();
        RetryingTransport transport = new RetryingTransport(client, RETRY, delay -> {}, Duration.ofNanos(1), () -> {
            long t = now.get();
            now.addAndGet(10);
            return t;
        });

        TransportResult result = transport.execute(REQUEST);

        verify(client, never()).send(any(), any());
        assertThat(result.error().kind()).isEqualTo(GatewayError.Kind.TIMEOUT);
    }
}
