package relay.account;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import relay.RelayException;
import relay.model.AccountInfo;
import relay.model.Lane;
import relay.model.Message;
import relay.spi.ConnectionProvider;
import relay.spi.MetricsExporter;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AccountManagerTest {

    private final InMemoryMessageStore store = new InMemoryMessageStore();
    private final FakeAccountClient.Factory irc = new FakeAccountClient.Factory("irc");
    private final CountingMetrics metrics = new CountingMetrics();
    private AccountManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            try {
                manager.close();
            } catch (RelayException ignored) {
                // tests that kill the manager assert on the failure themselves
            }
        }
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsNullConnectionProvider() {
        assertThrows(NullPointerException.class, () ->
                AccountManager.builder().messageStore(store).build());
    }

    @Test
    void builderRejectsNullMessageStore() {
        assertThrows(NullPointerException.class, () ->
                AccountManager.builder().connectionProvider(stubCp()).build());
    }

    @Test
    void builderRejectsZeroBatchSize() {
        assertThrows(IllegalArgumentException.class, () ->
                baseBuilder().batchSize(0).build());
    }

    @Test
    void builderRejectsNegativeRefreshInterval() {
        assertThrows(IllegalArgumentException.class, () ->
                baseBuilder().refreshInterval(Duration.ofSeconds(-1)).build());
    }

    @Test
    void builderRejectsZeroPollDelay() {
        assertThrows(IllegalArgumentException.class, () ->
                baseBuilder().pollDelay(Duration.ZERO).build());
    }

    @Test
    void builderRejectsBlankDefaultNick() {
        assertThrows(IllegalArgumentException.class, () ->
                baseBuilder().defaultNick(" ").build());
    }

    // ── Lifecycle ────────────────────────────────────────────────────

    @Test
    void refreshBeforeStartFails() {
        manager = baseBuilder().build();
        assertThrows(IllegalStateException.class, manager::refresh);
    }

    @Test
    void stopIsIdempotent() {
        manager = startManager(baseBuilder());
        manager.stop();
        manager.stop();
        assertEquals(AccountManager.State.STOPPED, manager.state());
        assertThrows(IllegalStateException.class, manager::refresh);
    }

    @Test
    void startTwiceFails() {
        manager = startManager(baseBuilder());
        assertThrows(IllegalStateException.class, manager::start);
    }

    // ── Reconciliation ───────────────────────────────────────────────

    @Test
    void startsOneClientPerEnabledAccountOfKnownKind() {
        store.putAccount(account("a", "irc", true));
        store.putAccount(account("b", "", true));
        store.putAccount(account("off", "irc", false));
        store.putAccount(account("tg", "telegram", true));

        manager = startManager(baseBuilder());

        assertEquals(Set.of("a", "b"), manager.activeAccounts());
        manager.refresh();
        assertEquals(1, irc.startedFor("a").size());
        assertEquals(1, irc.startedFor("b").size());
        assertEquals(2, metrics.started.get());
    }

    @Test
    void blankNickGetsDefault() {
        store.putAccount(account("a", "irc", true));

        manager = startManager(baseBuilder().defaultNick("bot"));

        assertEquals("bot", irc.startedFor("a").get(0).info().nick());
    }

    @Test
    void allowListRestrictsAccounts() {
        store.putAccount(account("a", "irc", true));
        store.putAccount(account("b", "irc", true));

        manager = startManager(baseBuilder().accounts(List.of("b")));

        assertEquals(Set.of("b"), manager.activeAccounts());
    }

    @Test
    void emptyAllowListRunsNothing() {
        store.putAccount(account("a", "irc", true));

        manager = startManager(baseBuilder().accounts(List.of()));
        manager.refresh();

        assertEquals(Set.of(), manager.activeAccounts());
        assertTrue(irc.started.isEmpty());
    }

    @Test
    void disabledAccountIsStopped() {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient client = irc.startedFor("a").get(0);

        store.putAccount(account("a", "irc", false));
        manager.refresh();

        assertEquals(Set.of(), manager.activeAccounts());
        assertTrue(client.isStopped());
        assertEquals(1, metrics.stopped.get());
    }

    @Test
    void deadClientIsRestarted() {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient first = irc.startedFor("a").get(0);

        first.crash();
        manager.refresh();

        assertEquals(2, irc.startedFor("a").size());
        assertTrue(first.isStopped());
        assertEquals(Set.of("a"), manager.activeAccounts());
    }

    @Test
    void runningClientReceivesUpdatedInfo() {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient client = irc.startedFor("a").get(0);

        store.putAccount(new AccountInfo("a", "irc", "", "irc.example.net:6697", true, false,
                "newnick", "", "", 0, true, List.of()));
        manager.refresh();

        assertEquals(1, irc.startedFor("a").size());
        assertEquals("newnick", client.info().nick());
    }

    @Test
    void failedRefreshKeepsRunningClients() {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());

        store.failLoads = true;
        manager.refresh();

        assertEquals(Set.of("a"), manager.activeAccounts());
        assertEquals(1, metrics.refreshFailures.get());
    }

    @Test
    void refreshStopsClientStillHandingOverMessages() throws Exception {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient client = irc.startedFor("a").get(0);

        for (int i = 0; i < 200; i++) {
            client.receive(Message.builder().account("a").text("m" + i).build());
        }
        store.putAccount(account("a", "irc", false));
        CompletableFuture<Void> refreshed = CompletableFuture.runAsync(manager::refresh);

        refreshed.get(5, TimeUnit.SECONDS);
        assertTrue(client.isStopped());
        assertEquals(Set.of(), manager.activeAccounts());
        assertEquals(200, store.messages(Lane.INCOMING).size());
    }

    // ── Incoming lane ────────────────────────────────────────────────

    @Test
    void incomingMessagesAreStored() {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient client = irc.startedFor("a").get(0);

        client.receive(Message.builder().account("a").channel("#chan").nick("joe").text("hello").build());

        awaitTrue(() -> store.messages(Lane.INCOMING).size() == 1);
        assertEquals("hello", store.messages(Lane.INCOMING).get(0).text());
    }

    @Test
    void sentAcknowledgmentAdvancesCursor() {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient client = irc.startedFor("a").get(0);

        client.receive(pong("a", "sent:7"));

        awaitTrue(() -> store.cursor("a") == 7);
        assertTrue(store.messages(Lane.INCOMING).isEmpty());
    }

    @Test
    void malformedAcknowledgmentIsIgnored() {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient client = irc.startedFor("a").get(0);

        client.receive(pong("a", "sent:abc"));
        client.receive(pong("a", "keepalive"));
        client.receive(Message.builder().account("a").text("marker").build());

        awaitTrue(() -> store.messages(Lane.INCOMING).size() == 1);
        assertEquals(0, store.cursor("a"));
        assertEquals("marker", store.messages(Lane.INCOMING).get(0).text());
    }

    @Test
    void failedIncomingInsertKillsManager() {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient client = irc.startedFor("a").get(0);

        store.failInserts = true;
        client.receive(Message.builder().account("a").text("lost").build());

        awaitTrue(() -> manager.state() == AccountManager.State.STOPPED);
        RelayException e = assertThrows(RelayException.class, manager::stop);
        assertNotNull(e.getCause());
        assertTrue(client.isStopped());
    }

    @Test
    void unknownRequestKillsManager() {
        manager = startManager(baseBuilder());

        manager.submit(cause -> { });

        RelayException e = assertThrows(RelayException.class, manager::stop);
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void stopDrainsClientsBlockedOnHandoff() {
        store.putAccount(account("a", "irc", true));
        store.putAccount(account("b", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient a = irc.startedFor("a").get(0);
        FakeAccountClient b = irc.startedFor("b").get(0);

        for (int i = 0; i < 5; i++) {
            a.receive(Message.builder().account("a").text("a" + i).build());
            b.receive(Message.builder().account("b").text("b" + i).build());
        }
        manager.stop();

        assertTrue(a.isStopped());
        assertTrue(b.isStopped());
        assertEquals(10, store.messages(Lane.INCOMING).size());
    }

    // ── Outgoing lane ────────────────────────────────────────────────

    @Test
    void failedEchoInsertKillsManager() {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());

        store.failEchoes = true;
        long id = store.addOutgoing("a", "hello");

        awaitTrue(() -> manager.state() == AccountManager.State.STOPPED);
        RelayException e = assertThrows(RelayException.class, manager::stop);
        assertTrue(e.getMessage().contains("cannot record echo of message " + id));
        assertEquals(0, store.cursor("a"));
        assertTrue(store.messages(Lane.INCOMING).isEmpty());
    }

    @Test
    void firstActivationSkipsExistingMessagesAndDeliversNewOnesInOrder() throws Exception {
        store.addOutgoing("a", "old-1");
        store.addOutgoing("a", "old-2");
        store.addOutgoing("a", "old-3");
        store.putAccount(account("a", "irc", true));

        manager = startManager(baseBuilder());
        FakeAccountClient client = irc.startedFor("a").get(0);
        assertEquals(3, client.lastId());
        assertEquals(3, store.cursor("a"));

        long id4 = store.addOutgoing("a", "new-4");
        long id5 = store.addOutgoing("a", "new-5");
        store.addOutgoing("other", "not-mine");

        Message first = client.outgoing().poll(5, TimeUnit.SECONDS);
        Message second = client.outgoing().poll(5, TimeUnit.SECONDS);
        assertNotNull(first);
        assertNotNull(second);
        assertEquals(id4, first.id());
        assertEquals(id5, second.id());
        assertNull(client.outgoing().poll(200, TimeUnit.MILLISECONDS));

        awaitTrue(() -> store.messages(Lane.INCOMING).size() == 2);
        List<String> echoNonces = new ArrayList<>();
        for (Message echo : store.messages(Lane.INCOMING)) {
            echoNonces.add(echo.nonce());
        }
        assertEquals(List.of(first.nonce(), second.nonce()), echoNonces);
        assertEquals(2, metrics.delivered.get());
    }

    @Test
    void firstActivationOnEmptyStoreLeavesCursorUnset() throws Exception {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient client = irc.startedFor("a").get(0);
        assertEquals(0, client.lastId());
        assertEquals(0, store.cursor("a"));

        long id = store.addOutgoing("a", "first");
        Message delivered = client.outgoing().poll(5, TimeUnit.SECONDS);
        assertNotNull(delivered);
        assertEquals(id, delivered.id());
        // Only the acknowledgment moves the stored cursor off 0.
        assertEquals(0, store.cursor("a"));
    }

    @Test
    void restartedClientResumesFromPersistedCursor() throws Exception {
        store.putAccount(account("a", "irc", true));
        manager = startManager(baseBuilder());
        FakeAccountClient first = irc.startedFor("a").get(0);

        long id1 = store.addOutgoing("a", "one");
        long id2 = store.addOutgoing("a", "two");
        assertEquals(id1, first.outgoing().poll(5, TimeUnit.SECONDS).id());
        assertEquals(id2, first.outgoing().poll(5, TimeUnit.SECONDS).id());
        first.receive(pong("a", "sent:" + id1));
        awaitTrue(() -> store.cursor("a") == id1);

        first.crash();
        manager.refresh();
        FakeAccountClient second = irc.startedFor("a").get(1);

        // Unacknowledged message is delivered again; its echo already exists.
        Message replay = second.outgoing().poll(5, TimeUnit.SECONDS);
        assertNotNull(replay);
        assertEquals(id2, replay.id());
        awaitTrue(() -> metrics.echoDuplicates.get() == 1);
        assertEquals(2, store.messages(Lane.INCOMING).size());
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private AccountManager.Builder baseBuilder() {
        return AccountManager.builder()
                .connectionProvider(stubCp())
                .messageStore(store)
                .discoverClientFactories(false)
                .clientFactory(irc)
                .refreshInterval(Duration.ZERO)
                .pollDelay(Duration.ofMillis(10))
                .metrics(metrics);
    }

    private static AccountManager startManager(AccountManager.Builder builder) {
        AccountManager m = builder.build();
        m.start();
        // The first pass runs before any request is served.
        m.activeAccounts();
        return m;
    }

    static AccountInfo account(String name, String kind, boolean enabled) {
        return new AccountInfo(name, kind, "", "irc.example.net:6667", false, false, "", "", "",
                0, enabled, List.of());
    }

    private static Message pong(String account, String text) {
        return Message.builder().account(account).command(Message.PONG).text(text).build();
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError(e);
            }
        }
    }

    static ConnectionProvider stubCp() {
        return () -> (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                (proxy, method, args) -> {
                    if ("getTransactionIsolation".equals(method.getName())) {
                        return Connection.TRANSACTION_READ_COMMITTED;
                    }
                    if (method.getReturnType() == boolean.class) return false;
                    return null;
                });
    }

    static final class CountingMetrics implements MetricsExporter {
        final AtomicInteger stored = new AtomicInteger();
        final AtomicInteger acks = new AtomicInteger();
        final AtomicInteger delivered = new AtomicInteger();
        final AtomicInteger echoDuplicates = new AtomicInteger();
        final AtomicInteger refreshFailures = new AtomicInteger();
        final AtomicInteger started = new AtomicInteger();
        final AtomicInteger stopped = new AtomicInteger();

        @Override
        public void incrementIncomingStored() {
            stored.incrementAndGet();
        }

        @Override
        public void incrementAckApplied() {
            acks.incrementAndGet();
        }

        @Override
        public void incrementOutgoingDelivered() {
            delivered.incrementAndGet();
        }

        @Override
        public void incrementEchoDuplicate() {
            echoDuplicates.incrementAndGet();
        }

        @Override
        public void incrementRefreshFailure() {
            refreshFailures.incrementAndGet();
        }

        @Override
        public void incrementClientStarted() {
            started.incrementAndGet();
        }

        @Override
        public void incrementClientStopped() {
            stopped.incrementAndGet();
        }

        @Override
        public void recordActiveClients(int count) {
        }
    }
}
