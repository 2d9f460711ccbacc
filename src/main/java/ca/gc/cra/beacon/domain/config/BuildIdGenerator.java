package ca.gc.cra.beacon.domain.config;

import java.util.Optional;

/**
 * Hook that supplies a custom build identifier.
 *
 * <p>Referenced from {@code beacon.config.yaml} as {@code generateBuildId: !hook com.example.MyGenerator}.
 * Implementations need a public no-argument constructor when loaded from YAML.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface BuildIdGenerator {
  /**
   * Generates the build id.
   *
   * @return build id, or empty to let the build pick a random one
   */
  Optional<String> generate();

  /** Generator used by the defaults; never produces an id. */
  BuildIdGenerator NONE = Optional::empty;
}
