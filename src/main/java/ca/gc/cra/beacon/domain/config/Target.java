package ca.gc.cra.beacon.domain.config;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Deployment target of the build output.
 *
 * @since 0.1.0
 */
public enum Target {
  SERVER("server"),
  SERVERLESS("serverless"),
  EXPERIMENTAL_SERVERLESS_TRACE("experimental-serverless-trace");

  private final String value;

  Target(String value) {
    this.value = value;
  }

  /**
   * Returns the literal used in configuration files.
   *
   * @return configuration literal
   */
  public String value() {
    return value;
  }

  /**
   * Indicates whether pages are emitted as standalone serverless functions.
   *
   * @return {@code true} for {@link #SERVERLESS} and {@link #EXPERIMENTAL_SERVERLESS_TRACE}
   */
  public boolean isServerlessLike() {
    return this == SERVERLESS || this == EXPERIMENTAL_SERVERLESS_TRACE;
  }

  /**
   * Looks up a target by its configuration literal.
   *
   * @param raw literal such as {@code "serverless"}; may be {@code null}
   * @return matching target, or empty when unknown
   */
  public static Optional<Target> fromValue(String raw) {
    return Arrays.stream(values()).filter(t -> t.value.equals(raw)).findFirst();
  }

  /**
   * Lists the accepted literals for diagnostics.
   *
   * @return comma separated literals
   */
  public static String allowedValues() {
    return Arrays.stream(values()).map(Target::value).collect(Collectors.joining(", "));
  }
}
