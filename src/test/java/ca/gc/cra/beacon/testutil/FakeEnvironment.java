package ca.gc.cra.beacon.testutil;

import ca.gc.cra.beacon.application.port.EnvironmentPort;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Environment with fixed variables and processor count. */
public final class FakeEnvironment implements EnvironmentPort {
  private final Map<String, String> variables = new HashMap<>();
  private final int processors;

  public FakeEnvironment(int processors) {
    this.processors = processors;
  }

  public FakeEnvironment with(String name, String value) {
    variables.put(name, value);
    return this;
  }

  @Override
  public Optional<String> variable(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  @Override
  public int availableProcessors() {
    return processors;
  }
}
