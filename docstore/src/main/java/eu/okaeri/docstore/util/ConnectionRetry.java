package eu.okaeri.docstore.util;

import lombok.NonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.function.IntConsumer;
import java.util.logging.Logger;

/**
 * Retries connection establishment with exponential backoff.
 * <p>
 * Defaults come from system properties:
 * <ul>
 *   <li>{@code okaeri.docstore.connectRetry.initialBackoffMs} (default: 1000)</li>
 *   <li>{@code okaeri.docstore.connectRetry.maxBackoffMs} (default: 30000)</li>
 *   <li>{@code okaeri.docstore.connectRetry.multiplier} (default: 2.0)</li>
 *   <li>{@code okaeri.docstore.connectRetry.timeoutMs}, 0 for no timeout (default: 300000)</li>
 * </ul>
 * Only connection establishment is retried, queries are never retried.
 */
public final class ConnectionRetry<T> {

    private static final Logger LOGGER = Logger.getLogger(ConnectionRetry.class.getSimpleName());

    private final String contextName;
    private final Callable<T> connector;
    private Duration initialBackoff = Duration.ofMillis(Long.getLong("okaeri.docstore.connectRetry.initialBackoffMs", 1000L));
    private Duration maxBackoff = Duration.ofMillis(Long.getLong("okaeri.docstore.connectRetry.maxBackoffMs", 30_000L));
    private double multiplier = Double.parseDouble(System.getProperty("okaeri.docstore.connectRetry.multiplier", "2.0"));
    private Duration timeout = Duration.ofMillis(Long.getLong("okaeri.docstore.connectRetry.timeoutMs", 300_000L));
    private IntConsumer onRetry = attempt -> {
    };

    private ConnectionRetry(@NonNull String contextName, @NonNull Callable<T> connector) {
        this.contextName = contextName;
        this.connector = connector;
    }

    public static <T> ConnectionRetry<T> of(@NonNull String contextName, @NonNull Callable<T> connector) {
        return new ConnectionRetry<>(contextName, connector);
    }

    public ConnectionRetry<T> initialBackoff(@NonNull Duration backoff) {
        this.initialBackoff = backoff;
        return this;
    }

    public ConnectionRetry<T> maxBackoff(@NonNull Duration backoff) {
        this.maxBackoff = backoff;
        return this;
    }

    public ConnectionRetry<T> multiplier(double multiplier) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.multiplier = multiplier;
        return this;
    }

    /**
     * Total time allowed for connecting, {@link Duration#ZERO} retries forever.
     */
    public ConnectionRetry<T> timeout(@NonNull Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public ConnectionRetry<T> onRetry(@NonNull IntConsumer callback) {
        this.onRetry = callback;
        return this;
    }

    public T connect() {
        Instant deadline = this.timeout.isZero() ? null : Instant.now().plus(this.timeout);
        Duration backoff = this.initialBackoff;

        for (int attempt = 1; ; attempt++) {
            try {
                return this.connector.call();
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("connection to " + this.contextName + " interrupted", exception);
            } catch (Exception exception) {
                if ((deadline != null) && Instant.now().plus(backoff).isAfter(deadline)) {
                    throw new ConnectionException("cannot connect to " + this.contextName + " after " + attempt + " attempt(s)", exception);
                }

                LOGGER.warning("[" + this.contextName + "] Cannot connect (attempt " + attempt + ", next in "
                    + backoff.toMillis() + " ms): " + exception.getMessage());
                this.onRetry.accept(attempt);
                this.sleep(backoff);

                long next = (long) (backoff.toMillis() * this.multiplier);
                backoff = Duration.ofMillis(Math.min(next, this.maxBackoff.toMillis()));
            }
        }
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("connection to " + this.contextName + " interrupted", exception);
        }
    }

    /**
     * Thrown when connection establishment fails for good.
     */
    public static class ConnectionException extends RuntimeException {
        public ConnectionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
