package ca.gc.cra.beacon.application.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ErrorKind;
import ca.gc.cra.beacon.domain.config.I18nConfig;
import ca.gc.cra.beacon.domain.config.Phases;
import ca.gc.cra.beacon.domain.config.ResolvedConfig;
import ca.gc.cra.beacon.domain.config.Target;
import ca.gc.cra.beacon.infrastructure.fs.AncestorFileLocator;
import ca.gc.cra.beacon.infrastructure.yaml.YamlConfigModuleLoader;
import ca.gc.cra.beacon.testutil.FakeEnvironment;
import ca.gc.cra.beacon.testutil.LogCapture;
import ca.gc.cra.beacon.testutil.RecordingConfigFactory;
import ca.gc.cra.beacon.testutil.RecordingMetrics;
import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigResolverTest {
  @TempDir Path projectDir;

  private RecordingMetrics metrics;
  private AtomicInteger experimentalNotices;
  private ConfigResolver resolver;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetrics();
    experimentalNotices = new AtomicInteger();
    resolver = new ConfigResolver(
        new AncestorFileLocator(),
        new YamlConfigModuleLoader(),
        new FakeEnvironment(4),
        new OneTimeNotice(experimentalNotices::incrementAndGet),
        metrics);
  }

  @Test
  void missingFileYieldsDefaults() throws IOException {
    ResolvedConfig resolved = resolver.resolve(Phases.DEVELOPMENT_SERVER, projectDir);

    assertEquals(ResolvedConfig.fromMapping(resolver.defaults()), resolved);
    assertEquals(ConfigOrigins.DEFAULT, resolved.configOrigin());
    assertEquals(1L, metrics.counter("config.resolve.origin.default"));
  }

  @Test
  void fileValuesAreMergedValidatedAndTagged() throws IOException {
    Path file = write(ConfigOrigins.CONFIG_FILE, """
        distDir: build
        basePath: /docs
        images:
          domains: [cdn.example.com]
        experimental:
          i18n:
            locales: [en, fr, de]
            defaultLocale: fr
        """);

    ResolvedConfig resolved = resolver.resolve(Phases.PRODUCTION_BUILD, projectDir);

    assertEquals(ConfigOrigins.CONFIG_FILE, resolved.configOrigin());
    assertEquals(Optional.of(file.toAbsolutePath().normalize()), resolved.configFile());
    assertEquals("build", resolved.distDir());
    assertEquals("/docs", resolved.basePath());
    assertEquals("/docs", resolved.assetPrefix());
    assertEquals("/docs", resolved.amp().canonicalBase());
    assertEquals(List.of("cdn.example.com"), resolved.images().domains());
    assertEquals(List.of(320, 420, 768, 1024, 1200), resolved.images().deviceSizes());
    assertEquals("/_beacon/image/", resolved.images().path());
    I18nConfig i18n = resolved.experimental().i18n().orElseThrow();
    assertEquals(List.of("fr", "en", "de"), i18n.locales());
    assertEquals(3, resolved.experimental().cpus());
    assertEquals(1, experimentalNotices.get());
    assertEquals(1L, metrics.counter("config.resolve.requests"));
    assertEquals(1L, metrics.counter("config.resolve.origin.file"));
    assertTrue(metrics.observed("config.resolve.latencyNanos"));
  }

  @Test
  void fileIsFoundFromNestedDirectory() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "target: serverless\n");
    Path nested = Files.createDirectories(projectDir.resolve("pages").resolve("blog"));

    ResolvedConfig resolved = resolver.resolve(Phases.DEVELOPMENT_SERVER, nested);

    assertEquals(Target.SERVERLESS, resolved.target());
    assertTrue(resolved.target().isServerlessLike());
  }

  @Test
  void factoryFileIsInvokedWithPhase() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "!hook " + RecordingConfigFactory.class.getName() + "\n");

    ResolvedConfig resolved = resolver.resolve(Phases.EXPORT, projectDir);

    assertEquals("out-" + Phases.EXPORT, resolved.distDir());
    assertEquals(Phases.EXPORT, RecordingConfigFactory.lastPhase);
    assertSame(resolver.defaults(), RecordingConfigFactory.lastContext.defaultConfig());
  }

  @Test
  void buildIdHookIsBound() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "generateBuildId: !hook ca.gc.cra.beacon.testutil.FixedBuildIdGenerator\n");

    ResolvedConfig resolved = resolver.resolve(Phases.PRODUCTION_BUILD, projectDir);

    assertEquals(Optional.of("build-42"), resolved.generateBuildId().generate());
  }

  @Test
  void emptyFileWarnsAndResolvesDefaults() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "");

    try (LogCapture logs = LogCapture.of(ConfigResolver.class)) {
      ResolvedConfig resolved = resolver.resolve(Phases.DEVELOPMENT_SERVER, projectDir);

      assertEquals(ConfigOrigins.CONFIG_FILE, resolved.configOrigin());
      assertEquals(".beacon", resolved.distDir());
      assertEquals(
          List.of("Detected beacon.config.yaml, no exported configuration found"), logs.messages(Level.WARN));
    }
  }

  @Test
  void unsupportedVariantIsRejected() throws IOException {
    write("beacon.config.yml", "distDir: build\n");

    ConfigException ex = assertThrows(
        ConfigException.class, () -> resolver.resolve(Phases.DEVELOPMENT_SERVER, projectDir));

    assertEquals(ErrorKind.UNSUPPORTED_SOURCE, ex.kind());
    assertTrue(ex.getMessage().contains("beacon.config.yml'"), ex.getMessage());
    assertTrue(ex.getMessage().contains("beacon.config.yaml"), ex.getMessage());
    assertEquals(1L, metrics.counter("config.resolve.failures"));
    assertEquals(1L, metrics.counter("config.resolve.failures.unsupported_source"));
  }

  @Test
  void supportedFileWinsOverVariant() throws IOException {
    write("beacon.config.json", "{}");
    write(ConfigOrigins.CONFIG_FILE, "distDir: build\n");

    assertEquals("build", resolver.resolve(Phases.DEVELOPMENT_SERVER, projectDir).distDir());
  }

  @Test
  void nonMappingDocumentIsTypeMismatch() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "- distDir\n");

    ConfigException ex = assertThrows(
        ConfigException.class, () -> resolver.resolve(Phases.DEVELOPMENT_SERVER, projectDir));
    assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
  }

  @Test
  void overrideSkipsDiscoveryAndTagsServerOrigin() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "distDir: from-file\n");

    ResolvedConfig resolved = resolver.resolve(Phases.PRODUCTION_SERVER, projectDir, Map.of());

    assertEquals(ConfigOrigins.SERVER, resolved.configOrigin());
    assertEquals(".beacon", resolved.distDir());
    assertEquals(Optional.empty(), resolved.configFile());
    assertEquals(1L, metrics.counter("config.resolve.origin.server"));
  }

  @Test
  void overrideRunsPreMergeChecks() {
    ConfigException ex = assertThrows(
        ConfigException.class,
        () -> resolver.resolve(Phases.PRODUCTION_SERVER, projectDir, Map.of("target", "lambda")));

    assertEquals(ErrorKind.ENUM_VIOLATION, ex.kind());
    assertEquals(1L, metrics.counter("config.resolve.failures.enum_violation"));
  }

  @Test
  void validationErrorsSurfaceFromFile() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "basePath: /\n");

    ConfigException ex = assertThrows(
        ConfigException.class, () -> resolver.resolve(Phases.DEVELOPMENT_SERVER, projectDir));
    assertEquals(ErrorKind.STRUCTURAL_VIOLATION, ex.kind());
  }

  @Test
  void resolvingTheResultAgainIsStable() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, """
        basePath: /docs
        trailingSlash: true
        amp:
          canonicalBase: https://example.com/
        experimental:
          i18n:
            locales: [en, fr]
            defaultLocale: fr
            domains:
              - domain: example.fr
                defaultLocale: fr
        custom:
          nested: 1
        """);
    ResolvedConfig first = resolver.resolve(Phases.PRODUCTION_BUILD, projectDir);

    @SuppressWarnings("unchecked")
    Map<String, Object> plain = (Map<String, Object>) first.toMapping().toPlain();
    ResolvedConfig second = resolver.resolve(Phases.PRODUCTION_BUILD, projectDir, plain);

    assertEquals(first, second);
    assertEquals("https://example.com", second.amp().canonicalBase());
  }

  @Test
  void experimentalNoticeFiresOncePerResolver() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "experimental:\n  reactMode: concurrent\n");

    resolver.resolve(Phases.DEVELOPMENT_SERVER, projectDir);
    resolver.resolve(Phases.DEVELOPMENT_SERVER, projectDir);

    assertEquals(1, experimentalNotices.get());
  }

  @Test
  void legacyKeyInFileIsMigrated() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "exportTrailingSlash: true\n");

    ResolvedConfig resolved = resolver.resolve(Phases.EXPORT, projectDir);

    assertTrue(resolved.trailingSlash());
    assertTrue(resolved.extras().isEmpty());
  }

  private Path write(String name, String content) throws IOException {
    return Files.writeString(projectDir.resolve(name), content);
  }

  @Test
  void unknownTimestampKeysPassThrough() throws IOException {
    write(ConfigOrigins.CONFIG_FILE, "releaseDate: 2020-01-01\n");

    ResolvedConfig resolved = resolver.resolve(Phases.PRODUCTION_BUILD, projectDir);

    assertEquals("2020-01-01", resolved.extras().get("releaseDate"));
  }

  @Test
  void fractionalImageSizesAreBound() throws IOException {
    ResolvedConfig resolved = resolver.resolve(Phases.PRODUCTION_BUILD, projectDir,
        Map.of("images", Map.of("deviceSizes", List.of(320, 640.5))));

    assertEquals(List.of(320, 640.5), resolved.images().deviceSizes());
  }

  @Test
  void nullOptionalI18nFieldsAreTreatedAsAbsent() throws IOException {
    Map<String, Object> domain = new LinkedHashMap<>();
    domain.put("domain", "a.com");
    domain.put("defaultLocale", "en");
    domain.put("locales", null);
    Map<String, Object> i18n = new LinkedHashMap<>();
    i18n.put("locales", List.of("en", "fr"));
    i18n.put("defaultLocale", "en");
    i18n.put("localeDetection", null);
    i18n.put("domains", List.of(domain));

    ResolvedConfig resolved = resolver.resolve(Phases.PRODUCTION_BUILD, projectDir,
        Map.of("experimental", Map.of("i18n", i18n)));

    I18nConfig bound = resolved.experimental().i18n().orElseThrow();
    assertEquals(Optional.empty(), bound.localeDetection());
    assertEquals(List.of(), bound.domains().get(0).locales());
    assertEquals("a.com", bound.domains().get(0).domain());
  }
}
