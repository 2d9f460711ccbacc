package ca.gc.cra.beacon.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port that turns a discovered configuration file into the raw value it exports.
 *
 * <p>The returned value is untrusted and may be a {@code Map}, a {@code ConfigFactory} hook, or any other
 * plain value; {@code null} means the file exported nothing.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ConfigModuleLoader {
  /**
   * Loads the file.
   *
   * @param file absolute path returned by a {@link ConfigFileLocator}
   * @return raw exported value
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the file content is malformed
   */
  Object load(Path file) throws IOException;
}
