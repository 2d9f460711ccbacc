package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;

/**
 * Single check or fixup applied to a configuration tree.
 *
 * <p>Implementations either return the tree unchanged, return a corrected copy, or throw a
 * {@link ConfigException}. The input is never modified.</p>
 */
@FunctionalInterface
public interface ValidationPass {
  /**
   * Applies the pass.
   *
   * @param config tree to check
   * @return checked tree, possibly a corrected copy
   * @throws ConfigException when the tree violates the rule this pass enforces
   */
  ConfigValue.Mapping apply(ConfigValue.Mapping config);
}
