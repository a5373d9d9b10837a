package relay.account;

import relay.RelayException;
import relay.model.AccountInfo;
import relay.model.Lane;
import relay.model.Message;
import relay.spi.AccountClient;
import relay.spi.AccountClientFactory;
import relay.spi.ConnectionProvider;
import relay.spi.MessageStore;
import relay.spi.MetricsExporter;
import relay.util.DaemonThreadFactory;
import relay.util.Liveness;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Supervises one {@link AccountClient} per enabled account and moves messages between
 * the clients and the {@link MessageStore}.
 *
 * <p>A single manager thread owns the client registry. It takes messages from the shared
 * incoming queue and persists them, applies delivery acknowledgments to the account
 * cursor, serves {@link #refresh()} requests and re-reads the account table every
 * {@code refreshInterval}. Each active account also gets an {@link AccountTailer} that
 * hands the account's outgoing lane to its client in id order.
 *
 * <p>Delivery is at least once: the persisted cursor only advances when a client reports
 * a message as transmitted with a {@code PONG} whose text is {@code sent:<id>}, so a
 * restart may replay messages that were handed off but never acknowledged.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AccountManager manager = AccountManager.builder()
 *     .connectionProvider(provider)
 *     .messageStore(store)
 *     .clientFactory(new IrcClientFactory())
 *     .build();
 * manager.start();
 * ...
 * manager.close();
 * }</pre>
 */
public final class AccountManager implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(AccountManager.class.getName());

    static final String SENT_PREFIX = "sent:";
    private static final long LOOP_POLL_MS = 50;
    private static final long TAILER_JOIN_SECONDS = 5;

    public enum State {
        NEW, RUNNING, STOPPING, STOPPED
    }

    private final ConnectionProvider connectionProvider;
    private final MessageStore messageStore;
    private final AccountClientFactories clientFactories;
    private final Set<String> accountFilter;
    private final long refreshIntervalMs;
    private final long pollDelayMs;
    private final long handoffPollMs;
    private final int batchSize;
    private final String defaultNick;
    private final MetricsExporter metrics;

    private final Liveness liveness = new Liveness();
    private final BlockingQueue<Message> incoming = new SynchronousQueue<>();
    private final BlockingQueue<Request> requests = new LinkedBlockingQueue<>();
    // Owned by the manager thread.
    private final Map<String, AccountClient> clients = new LinkedHashMap<>();
    private final ExecutorService workers;

    private volatile State state = State.NEW;
    private Thread loopThread;

    private AccountManager(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.messageStore = Objects.requireNonNull(builder.messageStore, "messageStore");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        requirePositive(builder.pollDelay, "pollDelay");
        requirePositive(builder.handoffTimeout, "handoffTimeout");
        if (builder.refreshInterval == null || builder.refreshInterval.isNegative()) {
            throw new IllegalArgumentException("refreshInterval must be >= 0");
        }
        if (builder.defaultNick == null || builder.defaultNick.isBlank()) {
            throw new IllegalArgumentException("defaultNick must not be blank");
        }

        AccountClientFactories explicit = AccountClientFactories.of(builder.factories);
        this.clientFactories = builder.discoverFactories
                ? AccountClientFactories.discover().with(explicit)
                : explicit;
        this.accountFilter = builder.accounts == null ? null : Set.copyOf(builder.accounts);
        this.refreshIntervalMs = builder.refreshInterval.toMillis();
        this.pollDelayMs = builder.pollDelay.toMillis();
        this.handoffPollMs = builder.handoffTimeout.toMillis();
        this.batchSize = builder.batchSize;
        this.defaultNick = builder.defaultNick;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("relay-account-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    /**
     * Starts the manager thread. The first reconciliation pass runs immediately.
     *
     * @throws IllegalStateException if the manager was already started or stopped
     */
    public synchronized void start() {
        if (state != State.NEW) {
            throw new IllegalStateException("AccountManager already started");
        }
        state = State.RUNNING;
        loopThread = new DaemonThreadFactory("relay-manager-").newThread(this::loop);
        loopThread.start();
    }

    public State state() {
        return state;
    }

    public boolean isAlive() {
        return state == State.RUNNING && liveness.isAlive();
    }

    /**
     * Re-reads the account configuration and reconciles the running clients with it.
     * Blocks until the pass has completed.
     *
     * @throws IllegalStateException if the manager is not running or dies before serving
     *                               the request
     */
    public void refresh() {
        RefreshRequest request = new RefreshRequest(new CompletableFuture<>());
        await(submit(request), request.done());
    }

    /**
     * Names of the accounts that currently have a client, as seen by the manager thread.
     */
    public Set<String> activeAccounts() {
        SnapshotRequest request = new SnapshotRequest(new CompletableFuture<>());
        return await(submit(request), request.done());
    }

    Request submit(Request request) {
        if (state == State.NEW) {
            throw new IllegalStateException("AccountManager not started");
        }
        if (!liveness.isAlive()) {
            throw new IllegalStateException("AccountManager is not running");
        }
        requests.add(request);
        return request;
    }

    private <T> T await(Request request, CompletableFuture<T> done) {
        try {
            while (true) {
                try {
                    return done.get(LOOP_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (liveness.isDead()) {
                        request.fail(new IllegalStateException("AccountManager stopped before serving request"));
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for account manager", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(cause);
        }
    }

    /**
     * Stops every client, persists whatever they still hand over and waits for the
     * manager thread to exit. Safe to call more than once.
     *
     * @throws RelayException if the manager had terminated because of a failure
     */
    public void stop() {
        synchronized (this) {
            if (state == State.NEW) {
                state = State.STOPPED;
                liveness.markDead();
                workers.shutdown();
                return;
            }
        }
        if (liveness.kill(null)) {
            logger.info("Account manager stop requested");
        }
        try {
            liveness.awaitDead();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException("Interrupted while stopping account manager", e);
        }
        Optional<Throwable> failure = liveness.failure();
        if (failure.isPresent()) {
            Throwable cause = failure.get();
            throw new RelayException("Account manager terminated: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        stop();
    }

    // ── Manager loop ─────────────────────────────────────────────────

    private void loop() {
        logger.info("Account manager started");
        try {
            if (accountFilter != null && accountFilter.isEmpty()) {
                logger.info("No accounts assigned to this manager; waiting for stop");
                idle();
                return;
            }
            handleRefresh();
            long nextRefresh = nextRefresh();
            while (liveness.isAlive()) {
                Message msg = incoming.poll(LOOP_POLL_MS, TimeUnit.MILLISECONDS);
                if (msg != null) {
                    handleIncoming(msg);
                }
                Request request;
                while (liveness.isAlive() && (request = requests.poll()) != null) {
                    handleRequest(request);
                }
                if (liveness.isAlive() && System.currentTimeMillis() >= nextRefresh) {
                    handleRefresh();
                    nextRefresh = nextRefresh();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            liveness.kill(e);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Account manager loop failed", e);
            liveness.kill(e);
        } finally {
            die();
            Request pending;
            while ((pending = requests.poll()) != null) {
                pending.fail(new IllegalStateException("AccountManager stopped before serving request"));
            }
            state = State.STOPPED;
            liveness.markDead();
            logger.info("Account manager stopped");
        }
    }

    private void idle() throws InterruptedException {
        while (!liveness.awaitDying(LOOP_POLL_MS, TimeUnit.MILLISECONDS)) {
            Request request = requests.poll();
            if (request != null) {
                handleRequest(request);
            }
        }
    }

    private long nextRefresh() {
        return refreshIntervalMs > 0 ? System.currentTimeMillis() + refreshIntervalMs : Long.MAX_VALUE;
    }

    private void handleRequest(Request request) {
        if (request instanceof RefreshRequest refresh) {
            handleRefresh();
            refresh.done().complete(null);
        } else if (request instanceof SnapshotRequest snapshot) {
            snapshot.done().complete(Set.copyOf(clients.keySet()));
        } else {
            IllegalStateException e = new IllegalStateException("Unknown request received by account manager: " + request);
            request.fail(e);
            throw e;
        }
    }

    // ── Incoming messages ────────────────────────────────────────────

    private void handleIncoming(Message msg) {
        if (Message.PONG.equals(msg.command())) {
            handleAck(msg);
            return;
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            long id = messageStore.insert(conn, msg, Lane.INCOMING);
            metrics.incrementIncomingStored();
            logger.log(Level.FINE, "[{0}] Stored incoming message id={1}", new Object[]{msg.account(), id});
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "[" + msg.account() + "] Cannot insert incoming message; stopping account manager", e);
            liveness.kill(new RelayException("cannot insert incoming message for account " + msg.account(), e));
        }
    }

    private void handleAck(Message msg) {
        String text = msg.text();
        if (!text.startsWith(SENT_PREFIX)) {
            return;
        }
        long lastId;
        try {
            lastId = Long.parseLong(text.substring(SENT_PREFIX.length()).trim());
        } catch (NumberFormatException e) {
            lastId = -1;
        }
        if (lastId <= 0) {
            logger.warning("[" + msg.account() + "] Ignoring malformed delivery acknowledgment: " + text);
            return;
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            messageStore.updateCursor(conn, msg.account(), lastId);
            metrics.incrementAckApplied();
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.WARNING, "[" + msg.account() + "] Cannot update delivery cursor to " + lastId, e);
        }
    }

    // ── Reconciliation ───────────────────────────────────────────────

    private void handleRefresh() {
        List<AccountInfo> infos;
        try {
            infos = loadSnapshot();
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Cannot load account configuration; keeping current clients", e);
            metrics.incrementRefreshFailure();
            return;
        }

        Map<String, AccountInfo> good = new LinkedHashMap<>();
        for (AccountInfo info : infos) {
            if (info.enabled() && (accountFilter == null || accountFilter.contains(info.name()))) {
                good.put(info.name(), info.nick().isBlank() ? info.withNick(defaultNick) : info);
            }
        }

        List<AccountClient> removed = new ArrayList<>();
        Iterator<Map.Entry<String, AccountClient>> it = clients.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, AccountClient> entry = it.next();
            AccountClient client = entry.getValue();
            if (client.isAlive() && good.containsKey(entry.getKey())) {
                continue;
            }
            if (client.isDying()) {
                logger.info("[" + entry.getKey() + "] Client terminated; it will be restarted if still enabled");
            } else {
                logger.info("[" + entry.getKey() + "] Account removed or disabled; stopping client");
            }
            removed.add(client);
            it.remove();
        }
        if (stopClients(removed)) {
            Thread.currentThread().interrupt();
        }
        if (!liveness.isAlive() || Thread.currentThread().isInterrupted()) {
            metrics.recordActiveClients(clients.size());
            return;
        }

        for (AccountInfo info : good.values()) {
            AccountClient client = clients.get(info.name());
            if (client != null) {
                try {
                    client.updateInfo(info);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "[" + info.name() + "] Cannot update client settings", e);
                }
                continue;
            }
            Optional<AccountClientFactory> factory = clientFactories.forKind(info.kind());
            if (factory.isEmpty()) {
                logger.warning("[" + info.name() + "] Unknown account kind '" + info.kind() + "'; skipping");
                continue;
            }
            try {
                AccountInfo active = ensureCursor(info);
                client = factory.get().start(active, incoming);
            } catch (SQLException | RuntimeException e) {
                logger.log(Level.SEVERE, "[" + info.name() + "] Cannot start client", e);
                continue;
            }
            clients.put(info.name(), client);
            metrics.incrementClientStarted();
            workers.execute(new AccountTailer(client, liveness, connectionProvider, messageStore,
                    metrics, batchSize, pollDelayMs, handoffPollMs));
            logger.info("[" + info.name() + "] Client started after message id " + client.lastId());
        }
        metrics.recordActiveClients(clients.size());
    }

    private List<AccountInfo> loadSnapshot() throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            int isolation = conn.getTransactionIsolation();
            conn.setAutoCommit(false);
            conn.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
            try {
                List<AccountInfo> infos = messageStore.loadAccounts(conn);
                conn.commit();
                return infos;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
                conn.setTransactionIsolation(isolation);
            }
        }
    }

    /**
     * On first activation an account starts at the current end of the message table, so
     * a new account does not replay history. The position is persisted right away.
     *
     * <p>When the table is empty there is no position to persist and the stored cursor
     * stays at 0. If a message is queued after such an activation and the process restarts
     * before that message is acknowledged, the account is treated as new again and the
     * message is skipped.
     */
    private AccountInfo ensureCursor(AccountInfo info) throws SQLException {
        if (info.lastId() > 0) {
            return info;
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            long maxId = messageStore.maxMessageId(conn);
            if (maxId > 0) {
                messageStore.updateCursor(conn, info.name(), maxId);
            }
            logger.info("[" + info.name() + "] First activation; delivery starts after message id " + maxId);
            return info.withLastId(maxId);
        }
    }

    private void stopClient(AccountClient client) {
        try {
            client.stop();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "[" + client.accountName() + "] Client stopped with failure", e);
        }
        metrics.incrementClientStopped();
    }

    /**
     * Stops the given clients on worker threads while this thread keeps taking from
     * {@code incoming} until every {@code stop()} has returned.
     *
     * @return whether this thread was interrupted while waiting
     */
    private boolean stopClients(List<AccountClient> stopping) {
        CountDownLatch stopped = new CountDownLatch(stopping.size());
        for (AccountClient client : stopping) {
            workers.execute(() -> {
                try {
                    stopClient(client);
                } finally {
                    stopped.countDown();
                }
            });
        }
        boolean interrupted = Thread.interrupted();
        while (stopped.getCount() > 0) {
            try {
                Message msg = incoming.poll(LOOP_POLL_MS, TimeUnit.MILLISECONDS);
                if (msg != null) {
                    handleIncoming(msg);
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        return interrupted;
    }

    // ── Shutdown ─────────────────────────────────────────────────────

    private void die() {
        state = State.STOPPING;
        boolean interrupted = stopClients(new ArrayList<>(clients.values()));
        clients.clear();
        metrics.recordActiveClients(0);

        workers.shutdown();
        try {
            if (!workers.awaitTermination(TAILER_JOIN_SECONDS, TimeUnit.SECONDS)) {
                logger.warning("Account tailers did not finish within " + TAILER_JOIN_SECONDS + "s");
            }
        } catch (InterruptedException e) {
            interrupted = true;
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    // ── Requests ─────────────────────────────────────────────────────

    /** A request served by the manager thread. */
    interface Request {
        void fail(Throwable cause);
    }

    record RefreshRequest(CompletableFuture<Void> done) implements Request {
        @Override
        public void fail(Throwable cause) {
            done.completeExceptionally(cause);
        }
    }

    record SnapshotRequest(CompletableFuture<Set<String>> done) implements Request {
        @Override
        public void fail(Throwable cause) {
            done.completeExceptionally(cause);
        }
    }

    /**
     * Builder for {@link AccountManager}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private MessageStore messageStore;
        private final List<AccountClientFactory> factories = new ArrayList<>();
        private boolean discoverFactories = true;
        private Set<String> accounts;
        private Duration refreshInterval = Duration.ofSeconds(3);
        private Duration pollDelay = Duration.ofMillis(100);
        private Duration handoffTimeout = Duration.ofMillis(50);
        private int batchSize = 100;
        private String defaultNick = "relay";
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder messageStore(MessageStore messageStore) {
            this.messageStore = messageStore;
            return this;
        }

        /**
         * Registers a client factory. Explicit factories take precedence over discovered
         * ones of the same kind.
         */
        public Builder clientFactory(AccountClientFactory factory) {
            this.factories.add(Objects.requireNonNull(factory, "factory"));
            return this;
        }

        /**
         * Whether factories registered with {@link java.util.ServiceLoader} are picked up.
         * Defaults to {@code true}.
         */
        public Builder discoverClientFactories(boolean discover) {
            this.discoverFactories = discover;
            return this;
        }

        /**
         * Restricts the manager to the named accounts. {@code null} (the default) runs every
         * enabled account; an empty collection runs none.
         */
        public Builder accounts(Collection<String> accounts) {
            this.accounts = accounts == null ? null : new LinkedHashSet<>(accounts);
            return this;
        }

        /**
         * Interval between periodic reconciliation passes. Defaults to 3 seconds;
         * {@link Duration#ZERO} disables periodic passes.
         */
        public Builder refreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
            return this;
        }

        /**
         * How long a tailer sleeps after finding no new outgoing messages. Defaults to 100 ms.
         */
        public Builder pollDelay(Duration pollDelay) {
            this.pollDelay = pollDelay;
            return this;
        }

        /**
         * Slice used when offering a message to a client; liveness is re-checked between
         * slices. Defaults to 50 ms.
         */
        public Builder handoffTimeout(Duration handoffTimeout) {
            this.handoffTimeout = handoffTimeout;
            return this;
        }

        /**
         * Maximum outgoing messages read per query. Defaults to 100.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Nick given to accounts that have none configured. Defaults to {@code relay}. */
        public Builder defaultNick(String defaultNick) {
            this.defaultNick = defaultNick;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if a numeric or duration option is out of range
         */
        public AccountManager build() {
            return new AccountManager(this);
        }
    }
}
