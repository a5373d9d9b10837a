package relay.util;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the lifecycle of a supervised loop: alive, then dying once killed, then dead once
 * the loop has finished cleaning up.
 *
 * <p>The first {@link #kill} wins. Killing with {@code null} is an orderly stop and leaves
 * {@link #failure()} empty; killing with an exception records it as the reason the loop
 * ended. Blocking operations in the loop race against {@link #awaitDying} so shutdown time
 * stays bounded.
 *
 * <p>This class is thread-safe.
 */
public final class Liveness {
  private final CountDownLatch dying = new CountDownLatch(1);
  private final CountDownLatch dead = new CountDownLatch(1);
  private final AtomicBoolean killed = new AtomicBoolean();
  private final AtomicReference<Throwable> reason = new AtomicReference<>();

  /**
   * Moves to dying. Only the first call has an effect.
   *
   * @param cause the failure that ended the loop, or {@code null} for an orderly stop
   * @return {@code true} if this call did the transition
   */
  public boolean kill(Throwable cause) {
    if (!killed.compareAndSet(false, true)) {
      return false;
    }
    reason.set(cause);
    dying.countDown();
    return true;
  }

  /** Marks the loop as fully terminated. Implies dying. */
  public void markDead() {
    kill(null);
    dead.countDown();
  }

  public boolean isAlive() {
    return dying.getCount() > 0;
  }

  public boolean isDying() {
    return dying.getCount() == 0;
  }

  public boolean isDead() {
    return dead.getCount() == 0;
  }

  /**
   * Waits until the loop is killed.
   *
   * @return {@code true} if dying, {@code false} if the timeout elapsed first
   */
  public boolean awaitDying(long timeout, TimeUnit unit) throws InterruptedException {
    return dying.await(timeout, unit);
  }

  /**
   * Waits until the loop has terminated.
   *
   * @return {@code true} if dead, {@code false} if the timeout elapsed first
   */
  public boolean awaitDead(long timeout, TimeUnit unit) throws InterruptedException {
    return dead.await(timeout, unit);
  }

  /** Waits without bound until the loop has terminated. */
  public void awaitDead() throws InterruptedException {
    dead.await();
  }

  /** The failure the loop was killed with; empty while alive or after an orderly stop. */
  public Optional<Throwable> failure() {
    return Optional.ofNullable(reason.get());
  }
}
