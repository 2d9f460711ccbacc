package ca.gc.cra.beacon.domain.config;

import java.util.Objects;

/**
 * <strong>What:</strong> Raised when a BEACON configuration cannot be resolved.
 * <p><strong>Why:</strong> Keeps validation failures in the {@link IllegalArgumentException} family used by the
 * rest of the code base while exposing a machine-readable {@link ErrorKind}.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public class ConfigException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  /**
   * Creates an exception of the given kind.
   *
   * @param kind failure category; must not be {@code null}
   * @param message human-readable description shown to operators
   */
  public ConfigException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception of the given kind with an underlying cause.
   *
   * @param kind failure category; must not be {@code null}
   * @param message human-readable description shown to operators
   * @param cause underlying failure
   */
  public ConfigException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return error kind; never {@code null}
   */
  public ErrorKind kind() {
    return kind;
  }
}
