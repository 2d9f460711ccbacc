package ca.gc.cra.beacon.application.resolve;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigFactory;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

/**
 * Resolves function-form configuration sources into plain values.
 *
 * <p>A {@link ConfigFactory} is invoked with the build phase and the unmodified default registry. Factories must
 * answer synchronously; a {@link CompletionStage} or {@link Future} result is rejected. Any other value passes
 * through unchanged.</p>
 */
public final class ConfigNormalizer {
  private final ConfigValue.Mapping defaults;

  /**
   * Creates a normalizer that hands {@code defaults} to factories.
   *
   * @param defaults default registry; passed to factories as-is
   */
  public ConfigNormalizer(ConfigValue.Mapping defaults) {
    this.defaults = Objects.requireNonNull(defaults, "defaults");
  }

  /**
   * Normalizes a raw configuration value.
   *
   * @param phase opaque build phase identifier
   * @param raw value exported by the configuration source
   * @return the factory result, or {@code raw} when it is not a factory
   * @throws ConfigException of kind {@link ErrorKind#UNSUPPORTED_SOURCE} when the factory returns an asynchronous
   *     result, or {@link ErrorKind#TYPE_MISMATCH} when the exported hook is not a factory
   */
  public ConfigValue normalize(String phase, ConfigValue raw) {
    Objects.requireNonNull(raw, "raw");
    if (!(raw instanceof ConfigValue.Callable callable)) {
      return raw;
    }
    if (!(callable.target() instanceof ConfigFactory factory)) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Configuration hook " + callable.target().getClass().getName() + " is not a ConfigFactory");
    }
    Object produced = factory.create(phase, new ConfigFactory.FactoryContext(defaults));
    if (produced instanceof CompletionStage<?> || produced instanceof Future<?>) {
      throw new ConfigException(
          ErrorKind.UNSUPPORTED_SOURCE,
          "> Asynchronous result returned by " + factory.getClass().getName()
              + ". Configuration factories must return the configuration synchronously.");
    }
    return ConfigValues.parse(produced);
  }
}
