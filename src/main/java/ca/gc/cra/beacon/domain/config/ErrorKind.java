package ca.gc.cra.beacon.domain.config;

/**
 * Classifies why a configuration was rejected.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** A field's runtime type does not match its declared contract. */
  TYPE_MISMATCH,
  /** A numeric bound or a length limit was exceeded. */
  RANGE_VIOLATION,
  /** A value is not a member of a fixed allowed set. */
  ENUM_VIOLATION,
  /** A nested record is malformed or two records contradict each other. */
  STRUCTURAL_VIOLATION,
  /** The configuration source itself cannot be used (async result, unsupported file). */
  UNSUPPORTED_SOURCE,
  /** A reserved value was used where it is forbidden. */
  RESERVED_VALUE
}
