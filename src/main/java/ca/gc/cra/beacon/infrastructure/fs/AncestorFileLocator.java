package ca.gc.cra.beacon.infrastructure.fs;

import ca.gc.cra.beacon.application.port.ConfigFileLocator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks for configuration files in a directory and then in each of its ancestors.
 *
 * <p>Within one directory the names are tried in the order given; the nearest directory wins.</p>
 */
public final class AncestorFileLocator implements ConfigFileLocator {
  private static final Logger log = LoggerFactory.getLogger(AncestorFileLocator.class);

  @Override
  public Optional<Path> findUp(Path startDir, List<String> fileNames) throws IOException {
    Objects.requireNonNull(startDir, "startDir");
    Objects.requireNonNull(fileNames, "fileNames");
    Path current = startDir.toAbsolutePath().normalize();
    if (!Files.isDirectory(current)) {
      throw new NoSuchFileException(current.toString(), null, "project directory does not exist");
    }
    while (current != null) {
      for (String name : fileNames) {
        Path candidate = current.resolve(name);
        if (Files.isRegularFile(candidate)) {
          log.debug("Found {} at {}", name, candidate);
          return Optional.of(candidate);
        }
      }
      current = current.getParent();
    }
    return Optional.empty();
  }
}
