package ca.gc.cra.beacon.infrastructure.yaml;

import ca.gc.cra.beacon.application.port.ConfigModuleLoader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@code beacon.config.yaml} with SnakeYAML.
 *
 * <p>The document is returned as plain maps, lists and scalars. A document whose root is a {@code !hook} scalar
 * yields the hook instance itself, which is how a configuration factory is exported. An empty document yields an
 * empty map.</p>
 */
public final class YamlConfigModuleLoader implements ConfigModuleLoader {
  private final LoaderOptions options;

  /** Creates a loader with SnakeYAML's default limits. */
  public YamlConfigModuleLoader() {
    this(new LoaderOptions());
  }

  YamlConfigModuleLoader(LoaderOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Reads and parses {@code file}.
   *
   * @param file YAML document
   * @return parsed document
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or names an unusable hook
   */
  @Override
  public Object load(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new HookConstructor(options)).load(reader);
      return document == null ? Map.of() : document;
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + file, ex);
    }
  }
}
