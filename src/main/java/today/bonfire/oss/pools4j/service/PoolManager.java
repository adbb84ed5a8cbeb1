package today.bonfire.oss.pools4j.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import today.bonfire.oss.pools4j.common.PoolConstants;
import today.bonfire.oss.pools4j.exceptions.ManagerClosedException;
import today.bonfire.oss.pools4j.exceptions.PoolConfigurationError;
import today.bonfire.oss.pools4j.exceptions.PoolNotFoundException;
import today.bonfire.oss.pools4j.exceptions.PoolReleaseTimeoutException;
import today.bonfire.oss.pools4j.executor.BoundedWorkerPool;
import today.bonfire.oss.pools4j.executor.WorkerPool;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Default {@link ExecutorManager}.
 * <p>
 * The pool map is never modified in place. Reload builds a complete new map outside the lock
 * and swaps the reference under the write lock, so {@link #execute} always sees either the
 * old or the new pool set. The closed flag is checked without taking the lock.
 */
@Slf4j
public class PoolManager implements ExecutorManager {

  private final ReentrantReadWriteLock           lock   = new ReentrantReadWriteLock();
  private final AtomicBoolean                    closed = new AtomicBoolean(false);
  private final Function<PoolConfig, WorkerPool> poolFactory;
  private final PanicHandler                     panicHandler;
  private final Duration                         releaseTimeout;

  // guarded by lock
  private Map<String, PoolWrapper> pools;

  private PoolManager(Builder builder, List<PoolConfig> configs) {
    this.poolFactory    = builder.poolFactory;
    this.panicHandler   = builder.panicHandler;
    this.releaseTimeout = builder.releaseTimeout;
    this.pools          = buildPools(configs);
    log.info("Executor started with pools {}", pools.keySet());
  }

  /**
   * Creates a manager with default settings. Either every pool is created or none is.
   *
   * @throws PoolConfigurationError if the list is empty, a config is invalid or names repeat
   */
  public static PoolManager create(List<PoolConfig> configs) {
    return new Builder().build(configs);
  }

  @Override
  public void execute(String poolName, Runnable task) {
    if (closed.get()) throw new ManagerClosedException();

    var pool = lookup(poolName);
    while (true) {
      try {
        pool.submit(task);
        return;
      } catch (ManagerClosedException e) {
        // the pool was superseded by a reload between lookup and submit
        if (closed.get()) throw e;
        var current = lookup(poolName);
        if (current == pool) throw e;
        log.debug("Pool {} was replaced while submitting, retrying on the new pool", poolName);
        pool = current;
      }
    }
  }

  private PoolWrapper lookup(String poolName) {
    PoolWrapper pool;
    lock.readLock().lock();
    try {
      pool = pools.get(poolName);
    } finally {
      lock.readLock().unlock();
    }
    if (pool == null) throw new PoolNotFoundException(poolName);
    return pool;
  }

  @Override
  public void reload(List<PoolConfig> configs) {
    if (closed.get()) throw new ManagerClosedException();

    Map<String, PoolWrapper> newPools;
    try {
      newPools = buildPools(configs);
    } catch (PoolConfigurationError e) {
      log.error("Executor reload failed, keeping current pools", e);
      throw e;
    }

    Map<String, PoolWrapper> oldPools;
    try {
      oldPools = swapPools(newPools);
    } catch (ManagerClosedException e) {
      releasePools(newPools);
      throw e;
    }

    log.info("Executor reloaded with pools {}, releasing {} old pools", newPools.keySet(), oldPools.size());
    releasePools(oldPools);
  }

  @Override
  public void shutdown() {
    closed.set(true);
    var oldPools = swapPools(Map.of());
    log.info("Shutting down executor, releasing {} pools", oldPools.size());
    releasePools(oldPools);
  }

  @Override
  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public Set<String> poolNames() {
    lock.readLock().lock();
    try {
      return Set.copyOf(pools.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Map<String, PoolStats> stats() {
    Map<String, PoolWrapper> snapshot;
    lock.readLock().lock();
    try {
      snapshot = pools;
    } finally {
      lock.readLock().unlock();
    }
    var stats = new LinkedHashMap<String, PoolStats>();
    snapshot.forEach((name, pool) -> stats.put(name, pool.stats()));
    return Collections.unmodifiableMap(stats);
  }

  /**
   * Builds a wrapper for every config without touching the active pools.
   * On the first invalid or duplicate config every wrapper built so far is released.
   *
   * @return unmodifiable map in config order
   * @throws PoolConfigurationError if a config is invalid, a name repeats or a pool cannot be created
   */
  Map<String, PoolWrapper> buildPools(List<PoolConfig> configs) {
    var built = new LinkedHashMap<String, PoolWrapper>();
    for (var config : configs) {
      if (config != null && built.containsKey(config.name())) {
        releasePools(built);
        throw new PoolConfigurationError("Duplicate pool name: " + config.name());
      }
      try {
        var wrapper = new PoolWrapper(config, poolFactory, panicHandler);
        built.put(wrapper.name(), wrapper);
      } catch (PoolConfigurationError e) {
        releasePools(built);
        throw e;
      }
    }
    return Collections.unmodifiableMap(built);
  }

  /**
   * Replaces the active pool map and returns the previous one.
   * A non-empty map is refused once the manager is closed.
   *
   * @throws ManagerClosedException if the manager was closed and {@code newPools} is not empty
   */
  Map<String, PoolWrapper> swapPools(Map<String, PoolWrapper> newPools) {
    lock.writeLock().lock();
    try {
      if (closed.get() && !newPools.isEmpty()) throw new ManagerClosedException();
      var oldPools = pools;
      pools = newPools;
      return oldPools;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Releases all pools in parallel and returns when each one has drained or hit the release timeout.
   */
  void releasePools(Map<String, PoolWrapper> toRelease) {
    if (toRelease.isEmpty()) return;

    var done = new CountDownLatch(toRelease.size());
    for (var pool : toRelease.values()) {
      var releaser = new Thread(() -> {
        try {
          pool.releaseTimeout(releaseTimeout);
        } catch (PoolReleaseTimeoutException e) {
          log.warn("Pool {} did not drain within {}ms, remaining tasks keep running",
                   e.poolName(), e.timeout().toMillis());
        } catch (Exception e) {
          log.error("Failed to release pool {}", pool.name(), e);
        } finally {
          done.countDown();
        }
      }, "releaser-" + pool.name());
      releaser.setDaemon(true);
      releaser.start();
    }

    try {
      done.await();
    } catch (InterruptedException e) {
      log.warn("Interrupted while releasing {} pools", toRelease.size());
      Thread.currentThread().interrupt();
    }
  }

  public static class Builder {
    private PanicHandler                     panicHandler   = LoggingPanicHandler.INSTANCE;
    private Function<PoolConfig, WorkerPool> poolFactory    = config -> new BoundedWorkerPool(
        config.name(), config.size(), config.expiry(), config.nonBlocking());
    private Duration                         releaseTimeout = PoolConstants.SHUTDOWN_TIMEOUT;

    /**
     * @param handler receives failures thrown by tasks on any pool of this manager.
     *                if null, failures are written to the error log
     */
    public Builder panicHandler(PanicHandler handler) {
      this.panicHandler = handler == null ? LoggingPanicHandler.INSTANCE : handler;
      return this;
    }

    /**
     * @param factory creates the worker pool behind each config. the config passed in is already validated.
     *                default is {@link BoundedWorkerPool}
     */
    public Builder poolFactory(Function<PoolConfig, WorkerPool> factory) {
      if (factory == null) throw new PoolConfigurationError("Pool factory cannot be null");
      this.poolFactory = factory;
      return this;
    }

    /**
     * @param timeout - how long reload and shutdown wait for each old pool to drain.
     *                default is 5 seconds. draining continues after the timeout
     */
    public Builder releaseTimeout(Duration timeout) {
      if (timeout == null || timeout.isNegative() || timeout.isZero())
        throw new PoolConfigurationError("Release timeout must be positive");
      this.releaseTimeout = timeout;
      return this;
    }

    /**
     * @throws PoolConfigurationError if no configs are given, a config is invalid, names repeat
     *                                or a pool cannot be created. pools created before the failure are released
     */
    public PoolManager build(List<PoolConfig> configs) {
      if (ObjectUtils.isEmpty(configs)) throw new PoolConfigurationError("No pool configs provided");
      return new PoolManager(this, configs);
    }
  }
}
