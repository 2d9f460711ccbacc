package ca.gc.cra.beacon.application.port;

import java.util.Optional;

/**
 * <strong>What:</strong> Read-only view of the process environment used to seed defaults.
 * <p><strong>Why:</strong> Lets tests pin the worker count and analytics id without touching real environment
 * variables.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.beacon.infrastructure.env.SystemEnvironmentAdapter
 */
public interface EnvironmentPort {
  /**
   * Reads an environment variable.
   *
   * @param name variable name
   * @return trimmed non-blank value, or empty
   */
  Optional<String> variable(String name);

  /**
   * Returns the number of processors available to the JVM.
   *
   * @return processor count, at least 1
   */
  int availableProcessors();
}
