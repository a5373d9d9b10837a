package relay.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void poolThreadsAreNumberedDaemons() throws Exception {
        DaemonThreadFactory factory = new DaemonThreadFactory("relay-account-");
        List<Thread> seen = new CopyOnWriteArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(2, factory);
        try {
            pool.submit(() -> seen.add(Thread.currentThread())).get();
            pool.submit(() -> seen.add(Thread.currentThread())).get();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertTrue(seen.stream().allMatch(Thread::isDaemon));
        assertTrue(seen.stream().allMatch(t -> t.getName().matches("relay-account-[12]")));
        assertEquals("relay-account-3", factory.newThread(() -> { }).getName());
    }

    @Test
    void uncaughtFailureIsLogged() throws Exception {
        Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(capture);
        try {
            Thread thread = new DaemonThreadFactory("relay-broker-").newThread(() -> {
                throw new IllegalStateException("boom");
            });
            thread.start();
            thread.join(5000);
        } finally {
            logger.removeHandler(capture);
        }

        assertEquals(1, records.size());
        assertEquals(Level.SEVERE, records.get(0).getLevel());
        assertEquals("boom", records.get(0).getThrown().getMessage());
        assertTrue(records.get(0).getMessage().contains("relay-broker-1"));
    }

    @Test
    void prefixIsRequired() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
