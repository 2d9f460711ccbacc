package ca.gc.cra.beacon.domain.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigValuesTest {

  @Test
  void parseBuildsTaggedTreeInInsertionOrder() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("distDir", "build");
    raw.put("pageExtensions", List.of("tsx", "mdx"));
    raw.put("images", Map.of("domains", List.of()));
    raw.put("basePath", null);

    ConfigValue.Mapping parsed = ConfigValues.parseMapping(raw);

    assertEquals(List.of("distDir", "pageExtensions", "images", "basePath"), List.copyOf(parsed.keys()));
    assertEquals(ConfigValue.Kind.SEQUENCE, parsed.get("pageExtensions").orElseThrow().kind());
    assertEquals(ConfigValue.Kind.MAPPING, parsed.get("images").orElseThrow().kind());
    assertSame(ConfigValue.Scalar.NULL, parsed.get("basePath").orElseThrow());
    assertEquals(raw, parsed.toPlain());
  }

  @Test
  void parseWrapsHooksAsCallables() {
    BuildIdGenerator generator = BuildIdGenerator.NONE;

    ConfigValue value = ConfigValues.parse(generator);

    assertEquals(ConfigValue.Kind.CALLABLE, value.kind());
    assertEquals("function", ConfigValues.typeName(value));
    assertSame(generator, value.toPlain());
  }

  @Test
  void parseRejectsNonStringKeys() {
    Map<Object, Object> raw = new HashMap<>();
    raw.put(1, "one");

    ConfigException ex = assertThrows(ConfigException.class, () -> ConfigValues.parse(raw));
    assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
  }

  @Test
  void parseRejectsUnknownObjects() {
    ConfigException ex = assertThrows(ConfigException.class, () -> ConfigValues.parse(new Object()));
    assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
  }

  @Test
  void typeNamesFollowConfigurationVocabulary() {
    assertEquals("string", ConfigValues.typeName(ConfigValue.Scalar.of("x")));
    assertEquals("number", ConfigValues.typeName(ConfigValue.Scalar.of(2.5)));
    assertEquals("boolean", ConfigValues.typeName(ConfigValue.Scalar.of(true)));
    assertEquals("null", ConfigValues.typeName(ConfigValue.Scalar.NULL));
    assertEquals("array", ConfigValues.typeName(ConfigValues.parse(Arrays.asList(1, 2))));
    assertEquals("object", ConfigValues.typeName(ConfigValue.Mapping.empty()));
  }

  @Test
  void absentCoversMissingAndNull() {
    assertTrue(ConfigValues.isAbsent(null));
    assertTrue(ConfigValues.isAbsent(ConfigValue.Scalar.NULL));
    assertFalse(ConfigValues.isAbsent(ConfigValue.Scalar.of(false)));
    assertFalse(ConfigValues.isAbsent(ConfigValue.Scalar.of("")));
  }

  @Test
  void mappingUpdatesReturnCopies() {
    ConfigValue.Mapping original = ConfigValues.parseMapping(Map.of("distDir", "build"));

    ConfigValue.Mapping updated = original
        .with("distDir", ConfigValue.Scalar.of("out"))
        .with("target", ConfigValue.Scalar.of("server"));
    ConfigValue.Mapping removed = updated.without("target");

    assertEquals("build", original.get("distDir").flatMap(v -> ((ConfigValue.Scalar) v).asString()).orElseThrow());
    assertEquals(2, updated.size());
    assertFalse(removed.has("target"));
    assertSame(removed, removed.without("missing"));
    assertThrows(UnsupportedOperationException.class, () -> original.entries().put("x", ConfigValue.Scalar.NULL));
  }

  @Test
  void scalarRejectsStructuredPayloads() {
    assertThrows(IllegalArgumentException.class, () -> new ConfigValue.Scalar(List.of()));
  }
}
