package ca.gc.cra.beacon.application.resolve.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PostMergePassesTest {

  @Test
  void publicDistDirIsReserved() {
    assertKind(ErrorKind.RESERVED_VALUE, new BuildDirectoryPass(), Map.of("distDir", " public "));
  }

  @Test
  void blankDistDirIsStructuralViolation() {
    assertKind(ErrorKind.STRUCTURAL_VIOLATION, new BuildDirectoryPass(), Map.of("distDir", "   "));
  }

  @Test
  void numericDistDirIsTypeMismatch() {
    assertKind(ErrorKind.TYPE_MISMATCH, new BuildDirectoryPass(), Map.of("distDir", 5));
  }

  @Test
  void pageExtensionsMustBeNonEmptyStrings() {
    assertKind(ErrorKind.STRUCTURAL_VIOLATION, new PageExtensionsPass(), Map.of("pageExtensions", List.of()));
    assertKind(ErrorKind.TYPE_MISMATCH, new PageExtensionsPass(), Map.of("pageExtensions", "tsx"));
    assertKind(ErrorKind.TYPE_MISMATCH, new PageExtensionsPass(), Map.of("pageExtensions", List.of("tsx", 1)));
  }

  @Test
  void assetPrefixMustBeString() {
    assertKind(ErrorKind.TYPE_MISMATCH, new AssetPrefixPass(), Map.of("assetPrefix", false));
  }

  @Test
  void basePathShapeIsChecked() {
    assertKind(ErrorKind.STRUCTURAL_VIOLATION, new BasePathPass(), Map.of("basePath", "/"));
    assertKind(ErrorKind.STRUCTURAL_VIOLATION, new BasePathPass(), Map.of("basePath", "docs"));
    assertKind(ErrorKind.STRUCTURAL_VIOLATION, new BasePathPass(), Map.of("basePath", "/docs/"));
    assertKind(ErrorKind.TYPE_MISMATCH, new BasePathPass(), Map.of("basePath", 1));

    ConfigValue.Mapping valid = ConfigValues.parseMapping(Map.of("basePath", "/docs"));
    assertSame(valid, new BasePathPass().apply(valid));
  }

  @Test
  void basePathFillsEmptyAssetPrefixAndCanonicalBase() {
    ConfigValue.Mapping config = ConfigValues.parseMapping(Map.of(
        "basePath", "/docs",
        "assetPrefix", "",
        "amp", Map.of("canonicalBase", "")));

    ConfigValue.Mapping result = new BasePathPropagationPass().apply(config);

    assertEquals(ConfigValue.Scalar.of("/docs"), result.get("assetPrefix").orElseThrow());
    ConfigValue.Mapping amp = (ConfigValue.Mapping) result.get("amp").orElseThrow();
    assertEquals(ConfigValue.Scalar.of("/docs"), amp.get("canonicalBase").orElseThrow());
    assertEquals(ConfigValue.Scalar.of(""), config.get("assetPrefix").orElseThrow());
  }

  @Test
  void basePathKeepsExplicitAssetPrefix() {
    ConfigValue.Mapping config = ConfigValues.parseMapping(Map.of(
        "basePath", "/docs",
        "assetPrefix", "https://cdn.example.com",
        "amp", Map.of("canonicalBase", "https://amp.example.com")));

    ConfigValue.Mapping result = new BasePathPropagationPass().apply(config);

    assertEquals(config, result);
  }

  @Test
  void imageSizesOutsideRangeAreListed() {
    ConfigException ex = assertKind(
        ErrorKind.RANGE_VIOLATION,
        new ImagesPass(),
        Map.of("images", Map.of("deviceSizes", List.of(0, 5000, 20000))));

    assertTrue(ex.getMessage().contains("(0, 20000)"), ex.getMessage());
    assertTrue(ex.getMessage().contains("deviceSizes"));
  }

  @Test
  void fractionalImageSizesWithinRangeAreAccepted() {
    ConfigValue.Mapping config = ConfigValues.parseMapping(
        Map.of("images", Map.of("deviceSizes", List.of(320, 640.5), "imageSizes", List.of(1.0, 16.5))));

    assertSame(config, new ImagesPass().apply(config));
    assertKind(ErrorKind.RANGE_VIOLATION, new ImagesPass(), Map.of("images", Map.of("imageSizes", List.of(0.5))));
    assertKind(
        ErrorKind.RANGE_VIOLATION, new ImagesPass(), Map.of("images", Map.of("imageSizes", List.of(Double.NaN))));
  }

  @Test
  void tooManyImageSizesAreRejected() {
    List<Integer> sizes = new ArrayList<>();
    for (int i = 1; i <= 26; i++) {
      sizes.add(i * 10);
    }
    assertKind(ErrorKind.RANGE_VIOLATION, new ImagesPass(), Map.of("images", Map.of("imageSizes", sizes)));
  }

  @Test
  void imageDomainsAreChecked() {
    assertKind(ErrorKind.TYPE_MISMATCH, new ImagesPass(), Map.of("images", Map.of("domains", "cdn.example.com")));
    assertKind(ErrorKind.TYPE_MISMATCH, new ImagesPass(), Map.of("images", Map.of("domains", List.of(1))));
    assertKind(
        ErrorKind.RANGE_VIOLATION,
        new ImagesPass(),
        Map.of("images", Map.of("domains", Collections.nCopies(51, "cdn.example.com"))));
  }

  @Test
  void imagesMustBeARecord() {
    assertKind(ErrorKind.TYPE_MISMATCH, new ImagesPass(), Map.of("images", List.of()));
  }

  @Test
  void validImagesPass() {
    ConfigValue.Mapping config = ConfigValues.parseMapping(Map.of("images", Map.of(
        "deviceSizes", List.of(1, 640, 10000),
        "imageSizes", List.of(16, 32),
        "domains", List.of("cdn.example.com"))));

    assertSame(config, new ImagesPass().apply(config));
  }

  @Test
  void imagePathGetsTrailingSlash() {
    ConfigValue.Mapping config = ConfigValues.parseMapping(Map.of("images", Map.of("path", "/_beacon/image")));

    ConfigValue.Mapping result = new ImagePathPass().apply(config);

    ConfigValue.Mapping images = (ConfigValue.Mapping) result.get("images").orElseThrow();
    assertEquals(ConfigValue.Scalar.of("/_beacon/image/"), images.get("path").orElseThrow());
    assertSame(result, new ImagePathPass().apply(result));
  }

  @Test
  void emptyImagePathIsLeftAlone() {
    ConfigValue.Mapping config = ConfigValues.parseMapping(Map.of("images", Map.of("path", "")));

    assertSame(config, new ImagePathPass().apply(config));
  }

  @Test
  void defaultLocaleMovesToFront() {
    ConfigValue.Mapping config = ConfigValues.parseMapping(Map.of("experimental", Map.of("i18n", Map.of(
        "locales", List.of("en", "fr", "de", "fr"),
        "defaultLocale", "fr"))));

    ConfigValue.Mapping result = new LocaleOrderPass().apply(config);

    ConfigValue.Mapping experimental = (ConfigValue.Mapping) result.get("experimental").orElseThrow();
    ConfigValue.Mapping i18n = (ConfigValue.Mapping) experimental.get("i18n").orElseThrow();
    assertEquals(ConfigValue.Sequence.ofStrings(List.of("fr", "en", "de")), i18n.get("locales").orElseThrow());
  }

  @Test
  void postMergeChainOrder() {
    List<ValidationPass> passes = ValidatorChain.postMerge().passes();

    assertEquals(9, passes.size());
    assertTrue(passes.get(3) instanceof BasePathPass);
    assertTrue(passes.get(4) instanceof BasePathPropagationPass);
    assertTrue(passes.get(8) instanceof LocaleOrderPass);
  }

  private static ConfigException assertKind(ErrorKind kind, ValidationPass pass, Map<String, ?> raw) {
    ConfigValue.Mapping config = ConfigValues.parseMapping(raw);
    ConfigException ex = assertThrows(ConfigException.class, () -> pass.apply(config));
    assertEquals(kind, ex.kind(), ex.getMessage());
    return ex;
  }
}
