package com.scholary.whisper.gateway.transport;

import java.io.IOException;
import java.net.Socket;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces a deadline on the write+read phase of a call.
 *
 * <p>Blocking socket writes have no timeout in Java, so the deadline is enforced from the side: a
 * single scheduler thread closes the socket when the deadline passes, which makes the blocked
 * read or write fail. The caller then asks {@link Deadline#disarm()} whether that is what
 * happened and reports a timeout instead of a plain I/O error.
 */
public class IoDeadlineWatchdog implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(IoDeadlineWatchdog.class);

  private final ScheduledThreadPoolExecutor scheduler;

  public IoDeadlineWatchdog() {
    this.scheduler =
        new ScheduledThreadPoolExecutor(
            1,
            runnable -> {
              Thread thread = new Thread(runnable, "whisper-io-watchdog");
              thread.setDaemon(true);
              return thread;
            });
    // Deadlines are long (minutes); do not keep cancelled ones queued until they would fire.
    this.scheduler.setRemoveOnCancelPolicy(true);
  }

  /**
   * Start the clock for one exchange on the given socket.
   *
   * @param socket the socket to close when the deadline passes
   * @param timeoutMs the deadline, relative to now
   * @return a handle that must be disarmed when the exchange ends
   */
  public Deadline arm(Socket socket, long timeoutMs) {
    Deadline deadline = new Deadline(socket, timeoutMs);
    deadline.future = scheduler.schedule(deadline::expire, timeoutMs, TimeUnit.MILLISECONDS);
    return deadline;
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }

  /** One armed deadline. */
  public static final class Deadline {

    private static final int ARMED = 0;
    private static final int DISARMED = 1;
    private static final int EXPIRED = 2;

    private final Socket socket;
    private final long timeoutMs;
    private final AtomicInteger state = new AtomicInteger(ARMED);
    private volatile ScheduledFuture<?> future;

    private Deadline(Socket socket, long timeoutMs) {
      this.socket = socket;
      this.timeoutMs = timeoutMs;
    }

    private void expire() {
      if (!state.compareAndSet(ARMED, EXPIRED)) {
        return;
      }
      LOGGER.warn("I/O deadline of {}ms elapsed, closing backend socket", timeoutMs);
      try {
        socket.close();
      } catch (IOException e) {
        LOGGER.debug("Ignoring error while closing timed-out socket: {}", e.getMessage());
      }
    }

    /**
     * Stop the clock.
     *
     * @return {@code true} if the deadline was stopped in time, {@code false} if it already fired
     *     and the socket has been closed
     */
    public boolean disarm() {
      boolean inTime = state.compareAndSet(ARMED, DISARMED);
      ScheduledFuture<?> scheduled = future;
      if (inTime && scheduled != null) {
        scheduled.cancel(false);
      }
      return inTime;
    }

    public boolean hasExpired() {
      return state.get() == EXPIRED;
    }

    public long timeoutMs() {
      return timeoutMs;
    }
  }
}
