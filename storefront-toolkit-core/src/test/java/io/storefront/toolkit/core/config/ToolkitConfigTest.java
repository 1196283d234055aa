package io.storefront.toolkit.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ToolkitConfig}.
 * <p>
 * Coverage:
 * - Global configuration (toolkit.properties)
 * - Component configuration (fallback to global)
 * - System property overrides
 * - Type-safe getters and defaults
 * - Error handling (missing keys, invalid formats)
 */
class ToolkitConfigTest {

  @AfterEach
  void clearSystemProperties() {
    System.clearProperty("breaker.threshold");
    System.clearProperty("test.invalid-int");
  }

  // =========================================================================
  // Global Configuration Tests
  // =========================================================================

  @Test
  void testGlobal_ReturnsGlobalContext() {
    ToolkitConfig config = ToolkitConfig.global();

    assertThat(config.context()).isEqualTo("global");
  }

  @Test
  void testGlobal_ReadsBreakerDefaults() {
    ToolkitConfig config = ToolkitConfig.global();

    assertThat(config.getInt("breaker.threshold")).isEqualTo(5);
    assertThat(config.getDuration("breaker.call-timeout-ms")).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.getDuration("breaker.reset-timeout-ms")).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void testGlobal_ReadsRetryBackoffFactor() {
    ToolkitConfig config = ToolkitConfig.global();

    assertThat(config.getDouble("retry.backoff-factor")).isEqualTo(2.0);
  }

  // =========================================================================
  // Component Configuration Tests
  // =========================================================================

  @Test
  void testComponent_OverridesGlobalValue() {
    ToolkitConfig config = ToolkitConfig.forComponent("catalog");

    assertThat(config.context()).isEqualTo("component:catalog");
    assertThat(config.getInt("breaker.threshold")).isEqualTo(3);
    assertThat(config.getLong("cache.ttl-ms")).isEqualTo(600_000L);
  }

  @Test
  void testComponent_FallsBackToGlobal() {
    ToolkitConfig config = ToolkitConfig.forComponent("catalog");

    assertThat(config.getInt("pool.concurrency")).isEqualTo(5);
    assertThat(config.keys()).contains("pool.concurrency", "breaker.threshold");
  }

  @Test
  void testComponent_WithoutOverrideFileBehavesLikeGlobal() {
    ToolkitConfig config = ToolkitConfig.forComponent("no-such-component");

    assertThat(config.getInt("breaker.threshold")).isEqualTo(5);
  }

  @Test
  void testComponent_RejectsBlankName() {
    assertThatThrownBy(() -> ToolkitConfig.forComponent(" "))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testWithComponent_LayersOverExplicitProperties() {
    Properties properties = new Properties();
    properties.setProperty("pool.concurrency", "7");
    properties.setProperty("breaker.threshold", "8");
    ToolkitConfig config = ToolkitConfig.of(properties).withComponent("catalog");

    assertThat(config.context()).isEqualTo("explicit/component:catalog");
    assertThat(config.getInt("breaker.threshold")).isEqualTo(3);
    assertThat(config.getInt("pool.concurrency")).isEqualTo(7);
    assertThat(config.contains("retry.max-attempts")).isFalse();
  }

  @Test
  void testWithComponent_WithoutOverrideFileKeepsBaseValues() {
    Properties properties = new Properties();
    properties.setProperty("breaker.threshold", "8");

    assertThat(ToolkitConfig.of(properties).withComponent("cart").getInt("breaker.threshold")).isEqualTo(8);
  }

  // =========================================================================
  // Overrides, defaults and errors
  // =========================================================================

  @Test
  void testSystemProperty_TakesPrecedence() {
    System.setProperty("breaker.threshold", "9");

    assertThat(ToolkitConfig.forComponent("catalog").getInt("breaker.threshold")).isEqualTo(9);
    assertThat(ToolkitConfig.global().getInt("breaker.threshold")).isEqualTo(9);
  }

  @Test
  void testMissingKey_ThrowsConfigurationException() {
    ToolkitConfig config = ToolkitConfig.global();

    assertThatThrownBy(() -> config.getString("does.not.exist"))
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("does.not.exist")
      .hasMessageContaining("global");
  }

  @Test
  void testMissingKey_ReturnsDefaults() {
    ToolkitConfig config = ToolkitConfig.global();

    assertThat(config.getInt("does.not.exist", 7)).isEqualTo(7);
    assertThat(config.getDuration("does.not.exist", Duration.ofMillis(5))).isEqualTo(Duration.ofMillis(5));
    assertThat(config.getBoolean("does.not.exist", true)).isTrue();
    assertThat(config.contains("does.not.exist")).isFalse();
  }

  @Test
  void testInvalidInt_ThrowsOrFallsBack() {
    System.setProperty("test.invalid-int", "not-a-number");
    ToolkitConfig config = ToolkitConfig.global();

    assertThatThrownBy(() -> config.getInt("test.invalid-int"))
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("Invalid int value");
    assertThat(config.getInt("test.invalid-int", 42)).isEqualTo(42);
  }

  @Test
  void testExplicitProperties_AreCopied() {
    Properties properties = new Properties();
    properties.setProperty("pool.concurrency", "11");
    ToolkitConfig config = ToolkitConfig.of(properties);
    properties.setProperty("pool.concurrency", "12");

    assertThat(config.getInt("pool.concurrency")).isEqualTo(11);
    assertThat(config.context()).isEqualTo("explicit");
  }

  @Test
  void testNegativeDuration_IsRejected() {
    Properties properties = new Properties();
    properties.setProperty("cache.ttl-ms", "-1");
    ToolkitConfig config = ToolkitConfig.of(properties);

    assertThatThrownBy(() -> config.getDuration("cache.ttl-ms"))
      .isInstanceOf(ConfigurationException.class);
  }
}
