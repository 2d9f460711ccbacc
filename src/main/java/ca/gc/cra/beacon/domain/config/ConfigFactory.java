package ca.gc.cra.beacon.domain.config;

/**
 * Function-form configuration source.
 *
 * <p>When the configuration file exports a factory (YAML document {@code !hook com.example.MyFactory}),
 * the factory is invoked once per resolution with the build phase and the untouched default registry.
 * It must return the configuration synchronously: a {@code Map}, a {@link ConfigValue}, or another plain value.
 * Returning a {@link java.util.concurrent.CompletionStage} or {@link java.util.concurrent.Future} is rejected.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ConfigFactory {
  /**
   * Produces the user configuration.
   *
   * @param phase opaque build phase identifier (see {@link Phases})
   * @param context reference data; {@link FactoryContext#defaultConfig()} is the unmodified default registry
   * @return configuration value
   */
  Object create(String phase, FactoryContext context);

  /**
   * Arguments handed to a {@link ConfigFactory}.
   *
   * @param defaultConfig the default registry the user configuration will be merged over
   */
  record FactoryContext(ConfigValue.Mapping defaultConfig) {}
}
