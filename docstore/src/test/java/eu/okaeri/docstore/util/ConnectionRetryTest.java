package eu.okaeri.docstore.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRetryTest {

    @Test
    void connect_succeeds_on_first_attempt() {
        String result = ConnectionRetry.of("test", () -> "success").connect();
        assertThat(result).isEqualTo("success");
    }

    @Test
    void connect_retries_until_success() {
        AtomicInteger attempts = new AtomicInteger(0);
        AtomicInteger retries = new AtomicInteger(0);

        String result = ConnectionRetry.of("test", () -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IllegalStateException("fail");
                }
                return "success";
            })
            .initialBackoff(Duration.ofMillis(5))
            .maxBackoff(Duration.ofMillis(10))
            .onRetry(attempt -> retries.incrementAndGet())
            .connect();

        assertThat(result).isEqualTo("success");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(retries.get()).isEqualTo(2);
    }

    @Test
    void connect_throws_after_timeout() {
        AtomicInteger attempts = new AtomicInteger(0);

        assertThatThrownBy(() -> ConnectionRetry.of("test-db", () -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("connection refused");
            })
            .initialBackoff(Duration.ofMillis(50))
            .timeout(Duration.ofMillis(120))
            .connect())
            .isInstanceOf(ConnectionRetry.ConnectionException.class)
            .hasMessageContaining("test-db")
            .hasMessageContaining("attempt")
            .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(attempts.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void multiplier_below_one_is_rejected() {
        assertThatThrownBy(() -> ConnectionRetry.of("test", () -> "success").multiplier(0.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("1.0");
    }

    @Test
    void interrupted_connector_stops_retrying() {
        assertThatThrownBy(() -> ConnectionRetry.of("test", () -> {
                throw new InterruptedException("interrupted");
            })
            .connect())
            .isInstanceOf(ConnectionRetry.ConnectionException.class)
            .hasMessageContaining("interrupted")
            .hasCauseInstanceOf(InterruptedException.class);

        assertThat(Thread.interrupted()).isTrue();
    }
}
