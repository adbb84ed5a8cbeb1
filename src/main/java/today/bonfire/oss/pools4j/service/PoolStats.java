package today.bonfire.oss.pools4j.service;

/**
 * Point in time view of a pool's occupancy.
 */
public record PoolStats(String name, int running, int free, int cap) {

  public boolean isFull() {
    return free <= 0;
  }
}
