package ca.gc.cra.beacon.domain.config;

/**
 * Well-known build phase identifiers passed to {@link ConfigFactory} hooks.
 *
 * <p>The resolver treats phases as opaque strings; these constants exist so hooks and callers agree on names.</p>
 */
public final class Phases {
  public static final String EXPORT = "phase-export";
  public static final String PRODUCTION_BUILD = "phase-production-build";
  public static final String PRODUCTION_SERVER = "phase-production-server";
  public static final String DEVELOPMENT_SERVER = "phase-development-server";

  private Phases() {}
}
