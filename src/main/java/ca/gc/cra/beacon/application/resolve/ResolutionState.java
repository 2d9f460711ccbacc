package ca.gc.cra.beacon.application.resolve;

/** States of a single {@link ConfigResolver} invocation. */
enum ResolutionState {
  DIRECT_OVERRIDE,
  FILE_DISCOVERY,
  NO_FILE_FALLBACK,
  RESOLVED,
  FAILED
}
