package ca.gc.cra.beacon.application.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.config.BuildIdGenerator;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ReactMode;
import ca.gc.cra.beacon.domain.config.ResolvedConfig;
import ca.gc.cra.beacon.domain.config.Target;
import ca.gc.cra.beacon.testutil.FakeEnvironment;
import ca.gc.cra.beacon.testutil.LogCapture;
import ch.qos.logback.classic.Level;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DefaultRegistryTest {

  @Test
  void workerHintLeavesOneWorkerFree() {
    FakeEnvironment environment = new FakeEnvironment(16).with(DefaultRegistry.WORKERS_ENV, "4");

    assertEquals(3, DefaultRegistry.workerCount(environment));
  }

  @Test
  void workerCountFallsBackToProcessors() {
    assertEquals(7, DefaultRegistry.workerCount(new FakeEnvironment(8)));
    assertEquals(1, DefaultRegistry.workerCount(new FakeEnvironment(1)));
  }

  @Test
  void nonNumericWorkerHintIsIgnoredWithWarning() {
    FakeEnvironment environment = new FakeEnvironment(8).with(DefaultRegistry.WORKERS_ENV, "lots");

    try (LogCapture logs = LogCapture.of(DefaultRegistry.class)) {
      assertEquals(7, DefaultRegistry.workerCount(environment));
      assertEquals(1, logs.messages(Level.WARN).size());
      assertTrue(logs.messages(Level.WARN).get(0).contains("lots"));
    }
  }

  @Test
  void defaultsBindToTypedSchema() {
    FakeEnvironment environment = new FakeEnvironment(4).with(DefaultRegistry.ANALYTICS_ENV, "UA-1");

    ResolvedConfig config = ResolvedConfig.fromMapping(DefaultRegistry.create(environment));

    assertEquals(".beacon", config.distDir());
    assertEquals("", config.assetPrefix());
    assertEquals(ConfigOrigins.DEFAULT, config.configOrigin());
    assertEquals(Optional.empty(), config.configFile());
    assertEquals(List.of("tsx", "ts", "jsx", "js"), config.pageExtensions());
    assertEquals(Target.SERVER, config.target());
    assertEquals("UA-1", config.analyticsId());
    assertEquals(List.of(320, 420, 768, 1024, 1200), config.images().deviceSizes());
    assertEquals("/_beacon/image", config.images().path());
    assertEquals(60_000L, config.onDemandEntries().maxInactiveAge());
    assertEquals(2, config.onDemandEntries().pagesBufferLength());
    assertEquals(3, config.experimental().cpus());
    assertEquals(ReactMode.LEGACY, config.experimental().reactMode());
    assertEquals(Optional.empty(), config.experimental().i18n());
    assertSame(BuildIdGenerator.NONE, config.generateBuildId());
  }

  @Test
  void typedSchemaConvertsBackToTheSameTree() {
    ConfigValue.Mapping defaults = DefaultRegistry.create(new FakeEnvironment(4));

    assertEquals(defaults, ResolvedConfig.fromMapping(defaults).toMapping());
  }

  @Test
  void registryStartsWithEnvAndEndsWithReactStrictMode() {
    List<String> keys = List.copyOf(DefaultRegistry.create(new FakeEnvironment(2)).keys());

    assertEquals("env", keys.get(0));
    assertEquals("reactStrictMode", keys.get(keys.size() - 1));
  }
}
