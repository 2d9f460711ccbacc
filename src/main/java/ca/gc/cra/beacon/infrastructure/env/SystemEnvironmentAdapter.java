package ca.gc.cra.beacon.infrastructure.env;

import ca.gc.cra.beacon.application.port.EnvironmentPort;
import java.util.Optional;

/** {@link EnvironmentPort} backed by the process environment and the JVM runtime. */
public final class SystemEnvironmentAdapter implements EnvironmentPort {
  @Override
  public Optional<String> variable(String name) {
    return Optional.ofNullable(System.getenv(name));
  }

  @Override
  public int availableProcessors() {
    return Runtime.getRuntime().availableProcessors();
  }
}
