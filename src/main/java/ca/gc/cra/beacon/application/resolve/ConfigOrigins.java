package ca.gc.cra.beacon.application.resolve;

import java.util.List;

/**
 * File names and origin tags recognized during resolution.
 */
public final class ConfigOrigins {
  /** Conventional configuration file name; also the origin tag of file-sourced configurations. */
  public static final String CONFIG_FILE = "beacon.config.yaml";
  /** Origin tag of the untouched defaults. */
  public static final String DEFAULT = "default";
  /** Origin tag of configurations handed in directly by a host process. */
  public static final String SERVER = "server";

  /** Variants of {@link #CONFIG_FILE} that are detected but rejected. */
  public static final List<String> UNSUPPORTED_VARIANTS = List.of(
      "beacon.config.yml",
      "beacon.config.json",
      "beacon.config.properties",
      "beacon.config.toml");

  private ConfigOrigins() {}
}
