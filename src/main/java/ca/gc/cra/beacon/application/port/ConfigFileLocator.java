package ca.gc.cra.beacon.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that finds the nearest configuration file by walking up the directory tree.
 * <p><strong>Role:</strong> External collaborator of {@code ConfigResolver}; implemented by
 * {@code AncestorFileLocator}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ConfigFileLocator {
  /**
   * Searches {@code startDir} and then each ancestor for the first directory containing one of
   * {@code fileNames}. Within one directory the names are tried in order.
   *
   * @param startDir directory the search starts from
   * @param fileNames candidate file names, most preferred first
   * @return absolute path of the first match, or empty when no ancestor contains a candidate
   * @throws IOException when a directory cannot be inspected
   */
  Optional<Path> findUp(Path startDir, List<String> fileNames) throws IOException;
}
