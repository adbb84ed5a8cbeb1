package today.bonfire.oss.pools4j.service;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import today.bonfire.oss.pools4j.exceptions.ManagerClosedException;
import today.bonfire.oss.pools4j.exceptions.PoolConfigurationError;
import today.bonfire.oss.pools4j.exceptions.PoolOverloadException;
import today.bonfire.oss.pools4j.exceptions.PoolReleaseTimeoutException;
import today.bonfire.oss.pools4j.executor.WorkerPool;
import today.bonfire.oss.pools4j.executor.WorkerPoolClosedException;
import today.bonfire.oss.pools4j.executor.WorkerPoolFullException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Owns one {@link WorkerPool}. Every submitted task is wrapped so failures go to the
 * {@link PanicHandler}, and pool errors are translated to the executor's exceptions.
 */
@Slf4j
@Accessors(fluent = true)
public class PoolWrapper {

  @Getter private final String       name;
  @Getter private final PoolConfig   config;
  private final         WorkerPool   pool;
  private final         PanicHandler panicHandler;

  /**
   * @param config       validated here, the repaired copy is kept
   * @param poolFactory  creates the underlying worker pool from the validated config
   * @param panicHandler receives task failures
   * @throws PoolConfigurationError if the config is invalid or the pool cannot be created
   */
  PoolWrapper(PoolConfig config, Function<PoolConfig, WorkerPool> poolFactory, PanicHandler panicHandler) {
    if (config == null) throw new PoolConfigurationError("Pool config cannot be null");
    this.config       = config.validate();
    this.name         = this.config.name();
    this.panicHandler = panicHandler;

    WorkerPool created;
    try {
      created = poolFactory.apply(this.config);
    } catch (RuntimeException e) {
      throw new PoolConfigurationError("Failed to create pool " + name, e);
    }
    if (created == null) throw new PoolConfigurationError("Pool factory returned no pool for " + name);
    this.pool = created;
    log.debug("Pool {} created with size {}, expiry {}, nonBlocking {}",
              name, this.config.size(), this.config.expiry(), this.config.nonBlocking());
  }

  /**
   * @throws PoolOverloadException  if the pool is non-blocking and full
   * @throws ManagerClosedException if the pool has been released
   */
  public void submit(Runnable task) {
    Objects.requireNonNull(task, "task");
    try {
      pool.submit(new PanicRecoveringTask(name, task, panicHandler));
    } catch (WorkerPoolFullException e) {
      throw new PoolOverloadException(name, e);
    } catch (WorkerPoolClosedException e) {
      throw new ManagerClosedException(e);
    }
  }

  /**
   * Releases the pool and waits at most {@code timeout} for its tasks to drain.
   * <p>
   * The timeout only limits how long the caller waits. The drain runs on its own thread and
   * keeps going after a timeout, worker threads are freed when the last task finishes.
   *
   * @throws PoolReleaseTimeoutException if the pool is still draining after {@code timeout}, or the
   *                                     caller was interrupted while waiting (interrupt flag restored)
   */
  public void releaseTimeout(Duration timeout) {
    var drain = CompletableFuture.runAsync(pool::release, r -> {
      Thread t = new Thread(r, "release-" + name);
      t.setDaemon(true);
      t.start();
    });

    try {
      drain.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new PoolReleaseTimeoutException(name, timeout);
    } catch (InterruptedException e) {
      // the caller stops waiting, the drain itself keeps going
      Thread.currentThread().interrupt();
      throw new PoolReleaseTimeoutException(name, timeout);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Release of pool " + name + " failed", e.getCause());
    }
  }

  public int running() {
    return pool.running();
  }

  public int free() {
    return pool.free();
  }

  public int cap() {
    return pool.cap();
  }

  public PoolStats stats() {
    return new PoolStats(name, pool.running(), pool.free(), pool.cap());
  }
}
