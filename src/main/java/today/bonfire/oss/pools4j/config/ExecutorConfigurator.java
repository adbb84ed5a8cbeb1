package today.bonfire.oss.pools4j.config;

import lombok.extern.slf4j.Slf4j;
import today.bonfire.oss.pools4j.exceptions.PoolConfigurationError;
import today.bonfire.oss.pools4j.service.ExecutorManager;
import today.bonfire.oss.pools4j.service.PoolManager;

import java.util.Objects;
import java.util.Optional;

/**
 * Wires an {@link ExecutorManager} to the application config: creates it at startup
 * and hot-reloads it when the {@code executor} section changes.
 */
@Slf4j
public class ExecutorConfigurator {

  private final    PoolManager.Builder managerBuilder;
  private volatile ExecutorManager     executor;

  public ExecutorConfigurator() {
    this(new PoolManager.Builder());
  }

  public ExecutorConfigurator(PoolManager.Builder managerBuilder) {
    this.managerBuilder = Objects.requireNonNull(managerBuilder, "managerBuilder");
  }

  /**
   * @return the new manager, empty when the executor is disabled
   * @throws PoolConfigurationError if the settings are invalid
   */
  public Optional<ExecutorManager> initExecutor(ExecutorSettings settings) {
    if (settings == null || !settings.enabled()) {
      log.info("Executor is disabled, skipping initialization");
      return Optional.empty();
    }
    settings.validate();
    var configs = settings.toPoolConfigs();
    executor = managerBuilder.build(configs);
    log.info("Executor initialized with {} pools", configs.size());
    return Optional.of(executor);
  }

  /**
   * Reloads the executor if its settings changed. Failures are logged and the current pools stay active.
   */
  public void onSettingsChanged(ExecutorSettings oldSettings, ExecutorSettings newSettings) {
    if (Objects.equals(oldSettings, newSettings)) return;
    log.info("Executor configuration changed, reloading executor");

    var current = executor;
    if (newSettings == null || !newSettings.enabled()) {
      log.info("Executor disabled in new config, keeping current pools");
      return;
    }
    if (current == null) {
      log.warn("Executor is not initialized, cannot reload configuration");
      return;
    }

    try {
      newSettings.validate();
      var configs = newSettings.toPoolConfigs();
      current.reload(configs);
      log.info("Executor reloaded successfully with {} pools", configs.size());
    } catch (RuntimeException e) {
      log.error("Failed to reload executor", e);
    }
  }

  public Optional<ExecutorManager> executor() {
    return Optional.ofNullable(executor);
  }

  public void shutdown() {
    var current = executor;
    if (current != null) current.shutdown();
  }
}
