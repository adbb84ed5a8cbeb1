package today.bonfire.oss.pools4j.service;

import today.bonfire.oss.pools4j.exceptions.ManagerClosedException;
import today.bonfire.oss.pools4j.exceptions.PoolConfigurationError;
import today.bonfire.oss.pools4j.exceptions.PoolNotFoundException;
import today.bonfire.oss.pools4j.exceptions.PoolOverloadException;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs tasks on named, independently sized pools.
 * <p>
 * All methods are safe to call from any number of threads. Pools isolate workloads from each other:
 * a saturated pool never affects submissions to another one.
 */
public interface ExecutorManager {

  /**
   * Submit a task to the named pool.
   * <p>
   * Returns once the task has been handed to a worker. For a blocking pool at capacity this waits
   * until a worker is free. Anything the task throws is passed to the configured {@link PanicHandler}
   * and never reaches the caller.
   *
   * @param poolName name of a configured pool
   * @param task     the work to run
   * @throws PoolNotFoundException  if no pool with this name is active
   * @throws PoolOverloadException  if the pool is non-blocking and at capacity
   * @throws ManagerClosedException if {@link #shutdown()} has been called
   */
  void execute(String poolName, Runnable task);

  /**
   * Replace every pool with pools built from {@code configs}.
   * <p>
   * New pools are built first. If any of them cannot be built the active pools stay in service
   * unchanged. Otherwise all pools are swapped in one step, and the old pools drain their accepted
   * tasks before being released.
   *
   * @param configs the complete new pool set
   * @throws PoolConfigurationError if a config is invalid, names repeat or a pool cannot be created
   * @throws ManagerClosedException if {@link #shutdown()} has been called
   */
  void reload(List<PoolConfig> configs);

  /**
   * Stop accepting tasks and release every pool, waiting a bounded time for each to drain.
   * The manager cannot be used afterwards.
   */
  void shutdown();

  boolean isClosed();

  /**
   * @return names of the active pools
   */
  Set<String> poolNames();

  /**
   * @return occupancy of every active pool keyed by pool name
   */
  Map<String, PoolStats> stats();
}
