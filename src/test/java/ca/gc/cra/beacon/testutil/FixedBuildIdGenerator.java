package ca.gc.cra.beacon.testutil;

import ca.gc.cra.beacon.domain.config.BuildIdGenerator;
import java.util.Optional;

/** Build id hook referenced from test YAML files. */
public final class FixedBuildIdGenerator implements BuildIdGenerator {
  @Override
  public Optional<String> generate() {
    return Optional.of("build-42");
  }
}
