package today.bonfire.oss.pools4j.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import today.bonfire.oss.pools4j.exceptions.PoolConfigurationError;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutorSettingsLoaderTest {

  @Test
  void loadsExecutorSectionFromClasspathFixture() throws IOException {
    try (var reader = new InputStreamReader(
        Objects.requireNonNull(getClass().getResourceAsStream("/executor.yaml")), StandardCharsets.UTF_8)) {
      var settings = ExecutorSettingsLoader.load(reader);

      assertThat(settings.enabled()).isTrue();
      assertThat(settings.pools()).hasSize(5);
      assertThat(settings.pools().get(0)).isEqualTo(new PoolSettings("http", 200, 10, true));
      assertThat(settings.pools().get(1)).isEqualTo(new PoolSettings("database", 50, 30, false));
      settings.validate();
    }
  }

  @Test
  void loadsFromPath(@TempDir Path dir) throws IOException {
    var file = dir.resolve("app.yaml");
    Files.writeString(file, "executor:\n"
                            + "  enabled: \"true\"\n"
                            + "  pools:\n"
                            + "    - name: jobs\n"
                            + "      size: \"12\"\n");

    var settings = ExecutorSettingsLoader.load(file);

    assertThat(settings).isPresent();
    assertThat(settings.get().enabled()).isTrue();
    // expiry and non_blocking fall back to defaults
    assertThat(settings.get().pools()).containsExactly(new PoolSettings("jobs", 12, 0, true));
  }

  @Test
  void missingFileGivesEmpty(@TempDir Path dir) throws IOException {
    assertThat(ExecutorSettingsLoader.load(dir.resolve("absent.yaml"))).isEmpty();
  }

  @Test
  void documentWithoutExecutorSectionIsDisabled() {
    assertThat(ExecutorSettingsLoader.load(new StringReader("server:\n  port: 80\n")))
        .isEqualTo(ExecutorSettings.disabled());
    assertThat(ExecutorSettingsLoader.load(new StringReader(""))).isEqualTo(ExecutorSettings.disabled());
  }

  @Test
  void wrongTypesAreRejected() {
    assertThatThrownBy(() -> ExecutorSettingsLoader.load(new StringReader("executor: 5\n")))
        .isInstanceOf(PoolConfigurationError.class);
    assertThatThrownBy(() -> ExecutorSettingsLoader.load(new StringReader("executor:\n  pools: http\n")))
        .isInstanceOf(PoolConfigurationError.class)
        .hasMessageContaining("executor.pools must be a list");
    assertThatThrownBy(() -> ExecutorSettingsLoader.load(new StringReader(
        "executor:\n  pools:\n    - name: a\n      size: lots\n")))
        .isInstanceOf(PoolConfigurationError.class)
        .hasMessageContaining("executor.pools[0].size");
    assertThatThrownBy(() -> ExecutorSettingsLoader.load(new StringReader(
        "executor:\n  enabled: maybe\n")))
        .isInstanceOf(PoolConfigurationError.class);
  }

  @Test
  void sizeOutsideIntRangeIsRejected() {
    assertThatThrownBy(() -> ExecutorSettingsLoader.load(new StringReader(
        "executor:\n  pools:\n    - name: a\n      size: 4294967297\n")))
        .isInstanceOf(PoolConfigurationError.class)
        .hasMessageContaining("executor.pools[0].size is out of range");
    assertThatThrownBy(() -> ExecutorSettingsLoader.load(new StringReader(
        "executor:\n  pools:\n    - name: a\n      expiry: 99999999999999999999\n")))
        .isInstanceOf(PoolConfigurationError.class)
        .hasMessageContaining("executor.pools[0].expiry is out of range");
  }

  @Test
  void fractionalNumbersAreRejected() {
    assertThatThrownBy(() -> ExecutorSettingsLoader.load(new StringReader(
        "executor:\n  pools:\n    - name: a\n      size: 1.5\n")))
        .isInstanceOf(PoolConfigurationError.class)
        .hasMessageContaining("executor.pools[0].size must be a whole number");
    assertThatThrownBy(() -> ExecutorSettingsLoader.load(new StringReader(
        "executor:\n  pools:\n    - name: a\n      expiry: 2.0\n")))
        .isInstanceOf(PoolConfigurationError.class)
        .hasMessageContaining("executor.pools[0].expiry must be a whole number");
  }

  @Test
  void malformedYamlIsRejected() {
    assertThatThrownBy(() -> ExecutorSettingsLoader.load(new StringReader("executor: [unclosed\n")))
        .isInstanceOf(PoolConfigurationError.class);
  }
}
