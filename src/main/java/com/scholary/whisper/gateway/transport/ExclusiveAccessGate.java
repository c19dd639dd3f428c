package com.scholary.whisper.gateway.transport;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion around the single backend connection.
 *
 * <p>One logical call holds the gate for its whole ensure-connection, write and read sequence.
 * There is no reader/writer split and no pipelining: a second caller blocks until the first one
 * has its response (or its failure) and leaves the gate. Waiting is not interruptible, so once a
 * caller has started waiting it will eventually run.
 *
 * <p>No fairness is promised beyond what {@link ReentrantLock} gives by default.
 */
public class ExclusiveAccessGate {

  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Run the given work while holding the gate.
   *
   * @param work the work to run
   * @return whatever the work returns
   * @throws IOException if the work throws it
   */
  public <T> T runExclusively(ExclusiveWork<T> work) throws IOException {
    lock.lock();
    try {
      return work.run();
    } finally {
      lock.unlock();
    }
  }

  /** Whether some caller currently holds the gate. */
  public boolean isBusy() {
    return lock.isLocked();
  }

  /** Estimate of the callers currently blocked on the gate. */
  public int waitingCallers() {
    return lock.getQueueLength();
  }

  /** Work executed under the gate. */
  @FunctionalInterface
  public interface ExclusiveWork<T> {
    T run() throws IOException;
  }
}
