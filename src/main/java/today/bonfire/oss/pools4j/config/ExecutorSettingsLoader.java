package today.bonfire.oss.pools4j.config;

import org.apache.commons.lang3.BooleanUtils;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import today.bonfire.oss.pools4j.common.PoolConstants;
import today.bonfire.oss.pools4j.exceptions.PoolConfigurationError;

import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the {@code executor} section from a YAML config document:
 * <pre>
 * executor:
 *   enabled: true
 *   pools:
 *     - name: http
 *       size: 200
 *       expiry: 10        # seconds
 *       non_blocking: true
 * </pre>
 * A document without an {@code executor} section gives {@link ExecutorSettings#disabled()}.
 */
public final class ExecutorSettingsLoader {

  private static final String SECTION = "executor";

  private ExecutorSettingsLoader() {}

  /**
   * @return empty if the file does not exist
   * @throws IOException            when the file cannot be read
   * @throws PoolConfigurationError when the YAML is malformed or a value has the wrong type
   */
  public static Optional<ExecutorSettings> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(load(reader));
    }
  }

  public static ExecutorSettings load(Reader reader) {
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new PoolConfigurationError("Failed to parse executor YAML config", ex);
    }
    if (document == null) {
      return ExecutorSettings.disabled();
    }

    var root    = asMap(document, "root");
    var section = root.get(SECTION);
    if (section == null) {
      return ExecutorSettings.disabled();
    }

    var executor = asMap(section, SECTION);
    var enabled  = asBoolean(executor.get("enabled"), false, SECTION + ".enabled");
    var pools    = new ArrayList<PoolSettings>();
    var rawPools = executor.get("pools");
    if (rawPools != null) {
      if (!(rawPools instanceof List<?> list)) {
        throw new PoolConfigurationError(SECTION + ".pools must be a list");
      }
      for (int i = 0; i < list.size(); i++) {
        pools.add(toPoolSettings(asMap(list.get(i), SECTION + ".pools[" + i + "]"), i));
      }
    }
    return new ExecutorSettings(enabled, pools);
  }

  private static PoolSettings toPoolSettings(Map<String, Object> pool, int index) {
    var context = SECTION + ".pools[" + index + "]";
    var name    = pool.get("name");
    return new PoolSettings(
        name == null ? null : name.toString(),
        asInt(pool.get("size"), 0, context + ".size"),
        asLong(pool.get("expiry"), 0, context + ".expiry"),
        asBoolean(pool.get("non_blocking"), PoolConstants.DEFAULT_NON_BLOCKING, context + ".non_blocking"));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new PoolConfigurationError(context + " must be a mapping");
    }
    var map = new LinkedHashMap<String, Object>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new PoolConfigurationError(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static int asInt(Object value, int defaultValue, String context) {
    try {
      return Math.toIntExact(asLong(value, defaultValue, context));
    } catch (ArithmeticException e) {
      throw new PoolConfigurationError(context + " is out of range, got " + value, e);
    }
  }

  private static long asLong(Object value, long defaultValue, String context) {
    if (value == null) return defaultValue;
    if (value instanceof Integer || value instanceof Long) return ((Number) value).longValue();
    if (value instanceof BigInteger big) {
      try {
        return big.longValueExact();
      } catch (ArithmeticException e) {
        throw new PoolConfigurationError(context + " is out of range, got " + value, e);
      }
    }
    if (value instanceof Number) {
      throw new PoolConfigurationError(context + " must be a whole number, got " + value);
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new PoolConfigurationError(context + " must be a number, got " + value, e);
    }
  }

  private static boolean asBoolean(Object value, boolean defaultValue, String context) {
    if (value == null) return defaultValue;
    if (value instanceof Boolean bool) return bool;
    var parsed = BooleanUtils.toBooleanObject(value.toString().trim());
    if (parsed == null) {
      throw new PoolConfigurationError(context + " must be true or false, got " + value);
    }
    return parsed;
  }
}
