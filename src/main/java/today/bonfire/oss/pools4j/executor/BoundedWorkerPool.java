package today.bonfire.oss.pools4j.executor;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link WorkerPool} backed by a {@link ThreadPoolExecutor}.
 * <p>
 * Admission is controlled by a semaphore with one permit per worker, so the executor queue
 * only ever holds tasks that already own a slot. Threads are created on demand and expire
 * after being idle for {@code expiry}.
 */
@Slf4j
public class BoundedWorkerPool implements WorkerPool {

  private static final long RELEASE_POLL_INTERVAL_MS = 1000;
  private static final long ACQUIRE_POLL_INTERVAL_MS = 50;

  private final String             name;
  private final int                capacity;
  private final boolean            nonBlocking;
  private final Semaphore          slots;
  private final ThreadPoolExecutor threadPool;
  private volatile boolean         closed = false;

  public BoundedWorkerPool(String name, int capacity, Duration expiry, boolean nonBlocking) {
    if (capacity <= 0)
      throw new IllegalArgumentException("Worker pool capacity must be positive, got " + capacity);
    if (expiry == null || expiry.isNegative() || expiry.isZero())
      throw new IllegalArgumentException("Worker expiry must be positive, got " + expiry);

    this.name        = name;
    this.capacity    = capacity;
    this.nonBlocking = nonBlocking;
    this.slots       = new Semaphore(capacity);
    this.threadPool  = new ThreadPoolExecutor(
        capacity,                       // core pool size
        capacity,                       // max pool size
        Math.max(1, expiry.toMillis()), // idle workers are recycled after this
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        new ThreadFactory() {
          private final AtomicInteger counter = new AtomicInteger();

          @Override
          public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("pool-" + name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
          }
        }
    );
    this.threadPool.allowCoreThreadTimeOut(true);
  }

  @Override
  public void submit(Runnable task) {
    if (closed) throw new WorkerPoolClosedException(name);

    if (nonBlocking) {
      if (!slots.tryAcquire()) {
        throw new WorkerPoolFullException(name, capacity);
      }
    } else {
      try {
        // waiters give up as soon as the pool is released
        while (!slots.tryAcquire(ACQUIRE_POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
          if (closed) throw new WorkerPoolClosedException(name);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RejectedExecutionException("Interrupted while waiting for a free worker in pool " + name, e);
      }
    }

    // release may have started while we were waiting for a slot
    if (closed) {
      slots.release();
      throw new WorkerPoolClosedException(name);
    }

    try {
      threadPool.execute(() -> {
        try {
          task.run();
        } finally {
          slots.release();
        }
      });
    } catch (RejectedExecutionException e) {
      slots.release();
      if (threadPool.isShutdown()) throw new WorkerPoolClosedException(name, e);
      log.error("Task rejected by pool {}", name, e);
      throw e;
    }
  }

  @Override
  public int running() {
    return capacity - slots.availablePermits();
  }

  @Override
  public int free() {
    return slots.availablePermits();
  }

  @Override
  public int cap() {
    return capacity;
  }

  /**
   * @return number of live worker threads, idle ones included
   */
  public int workers() {
    return threadPool.getPoolSize();
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void release() {
    closed = true;
    threadPool.shutdown();
    try {
      while (!threadPool.awaitTermination(RELEASE_POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
        log.debug("Waiting for pool {} to drain, {} tasks still running", name, running());
      }
      log.debug("Pool {} released", name);
    } catch (InterruptedException e) {
      log.warn("Interrupted while waiting for pool {} to drain", name);
      Thread.currentThread().interrupt();
    }
  }
}
