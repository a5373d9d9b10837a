package relay.broker;

import relay.util.DaemonThreadFactory;
import relay.util.Liveness;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps a single connection to a backend open on behalf of any number of callers.
 *
 * <p>The broker owns a dedicated thread. That thread dials through the {@link Dialer},
 * executes requests one at a time, pings the connection when it has been idle for
 * {@code pingInterval} and redials after any failure, waiting {@code redialDelay} between
 * failed dials. The wait is cut short when a handle is acquired or closed.
 *
 * <p>Lifetime is reference counted. The broker itself holds the first reference, released
 * by {@link #close()}; each {@link #acquire()} adds one, released by
 * {@link BrokerHandle#close()}. When the count reaches zero the connection is closed and
 * the thread exits; {@link #acquire()} fails from then on.
 *
 * <p>Callers never wait longer than {@code requestTimeout}. If the broker cannot answer in
 * time the caller gets the last recorded connection error, or a generic "sluggish"
 * message when there is none.
 *
 * @param <Q> request type
 * @param <R> result type
 */
public final class ConnectionBroker<Q, R> implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ConnectionBroker.class.getName());

    private static final long POLL_MS = 50;

    private enum Control { ACQUIRE, RELEASE }

    private record Pending<Q, R>(Q request, CompletableFuture<R> reply) {
    }

    private final Dialer<Q, R> dialer;
    private final String name;
    private final long requestTimeoutMs;
    private final long redialDelayMs;
    private final long pingIntervalMs;

    private final BlockingQueue<Pending<Q, R>> requests = new SynchronousQueue<>();
    private final BlockingQueue<Control> control = new SynchronousQueue<>();
    private final Liveness liveness = new Liveness();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile int references = 1;
    private volatile Exception lastError;

    private ConnectionBroker(Builder<Q, R> builder) {
        this.dialer = Objects.requireNonNull(builder.dialer, "dialer");
        this.name = Objects.requireNonNull(builder.name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.requestTimeoutMs = positiveMillis(builder.requestTimeout, "requestTimeout");
        this.redialDelayMs = positiveMillis(builder.redialDelay, "redialDelay");
        this.pingIntervalMs = positiveMillis(builder.pingInterval, "pingInterval");
    }

    public static <Q, R> Builder<Q, R> builder(Dialer<Q, R> dialer) {
        return new Builder<Q, R>().dialer(dialer);
    }

    private static long positiveMillis(Duration value, String option) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(option + " must be > 0");
        }
        return value.toMillis();
    }

    private void start() {
        new DaemonThreadFactory("relay-broker-" + name + "-").newThread(this::loop).start();
    }

    /**
     * Takes a new reference on the connection.
     *
     * @throws IllegalStateException if the broker has already shut down
     */
    public BrokerHandle<Q, R> acquire() {
        if (!send(Control.ACQUIRE)) {
            throw new IllegalStateException("ConnectionBroker.acquire called after closing connection");
        }
        return new BrokerHandle<>(this);
    }

    /**
     * Releases the broker's own reference. Handles acquired earlier keep working until
     * they are closed.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            release();
        }
    }

    /** Current reference count, for diagnostics. */
    public int references() {
        return references;
    }

    /** The most recent dial or connection failure, cleared by a successful dial. */
    public Optional<Exception> lastError() {
        return Optional.ofNullable(lastError);
    }

    /** Whether the broker thread has exited. */
    public boolean isTerminated() {
        return liveness.isDead();
    }

    public String name() {
        return name;
    }

    void release() {
        send(Control.RELEASE);
    }

    R execute(Q request) throws BrokerException {
        Pending<Q, R> pending = new Pending<>(request, new CompletableFuture<>());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(requestTimeoutMs);
        try {
            if (!requests.offer(pending, requestTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw timeout();
            }
            long remaining = Math.max(0, deadline - System.nanoTime());
            return pending.reply().get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw timeout();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException(name + " request interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new BrokerException(String.valueOf(cause.getMessage()), cause);
        }
    }

    private BrokerException timeout() {
        Exception err = lastError;
        if (err != null) {
            return new BrokerException(String.valueOf(err.getMessage()), err);
        }
        return new BrokerException(name + " is a bit sluggish right now. Please try again soon.");
    }

    private boolean send(Control event) {
        try {
            while (!liveness.isDead()) {
                if (control.offer(event, POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while contacting " + name + " broker", e);
        }
    }

    // ── Broker thread ────────────────────────────────────────────────

    private void loop() {
        try {
            while (references > 0) {
                ManagedConnection<Q, R> conn;
                try {
                    conn = dialer.dial();
                } catch (Exception e) {
                    lastError = e;
                    logger.log(Level.WARNING, "Cannot connect to " + name + "; retrying in " + redialDelayMs + "ms", e);
                    awaitRedial();
                    continue;
                }
                lastError = null;
                logger.fine("Connected to " + name);
                serve(conn);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning(name + " broker interrupted");
        } finally {
            liveness.markDead();
            logger.fine(name + " broker stopped");
        }
    }

    private void awaitRedial() throws InterruptedException {
        long deadline = System.currentTimeMillis() + redialDelayMs;
        long remaining;
        while ((remaining = deadline - System.currentTimeMillis()) > 0) {
            Control event = control.poll(Math.min(remaining, POLL_MS), TimeUnit.MILLISECONDS);
            if (event != null) {
                apply(event);
                return;
            }
        }
    }

    private void serve(ManagedConnection<Q, R> conn) throws InterruptedException {
        try {
            long lastUse = System.currentTimeMillis();
            while (references > 0) {
                Pending<Q, R> pending = requests.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (pending != null) {
                    lastUse = System.currentTimeMillis();
                    try {
                        pending.reply().complete(conn.execute(pending.request()));
                    } catch (Exception e) {
                        pending.reply().completeExceptionally(e);
                        lastError = e;
                        logger.log(Level.WARNING, name + " request failed; reconnecting", e);
                        return;
                    }
                }
                Control event = control.poll();
                if (event != null) {
                    apply(event);
                }
                if (references > 0 && System.currentTimeMillis() - lastUse >= pingIntervalMs) {
                    try {
                        conn.ping();
                    } catch (Exception e) {
                        lastError = e;
                        logger.log(Level.WARNING, name + " ping failed; reconnecting", e);
                        return;
                    }
                    lastUse = System.currentTimeMillis();
                }
            }
        } finally {
            try {
                conn.close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Cannot close " + name + " connection", e);
            }
        }
    }

    private void apply(Control event) {
        switch (event) {
            case ACQUIRE -> references = references + 1;
            case RELEASE -> references = references - 1;
        }
    }

    /**
     * Builder for {@link ConnectionBroker}. {@link #build()} starts the broker thread.
     */
    public static final class Builder<Q, R> {
        private Dialer<Q, R> dialer;
        private String name = "backend";
        private Duration requestTimeout = Duration.ofSeconds(5);
        private Duration redialDelay = Duration.ofSeconds(5);
        private Duration pingInterval = Duration.ofSeconds(5);

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder<Q, R> dialer(Dialer<Q, R> dialer) {
            this.dialer = dialer;
            return this;
        }

        /** Name used in thread names, logs and user-facing errors. Defaults to {@code backend}. */
        public Builder<Q, R> name(String name) {
            this.name = name;
            return this;
        }

        /** Maximum time a caller waits for a result. Defaults to 5 seconds. */
        public Builder<Q, R> requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /** Pause between failed dial attempts. Defaults to 5 seconds. */
        public Builder<Q, R> redialDelay(Duration redialDelay) {
            this.redialDelay = redialDelay;
            return this;
        }

        /** Idle time after which the connection is pinged. Defaults to 5 seconds. */
        public Builder<Q, R> pingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        public ConnectionBroker<Q, R> build() {
            ConnectionBroker<Q, R> broker = new ConnectionBroker<>(this);
            broker.start();
            return broker;
        }
    }
}
