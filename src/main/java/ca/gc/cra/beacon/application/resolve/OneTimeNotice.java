package ca.gc.cra.beacon.application.resolve;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Side effect that runs at most once per instance.
 * <p><strong>Role:</strong> Owned by whoever wires the resolver (see {@code CompositionRoot}) and injected, so
 * each test can start from a fresh instance.</p>
 * <p><strong>Thread-safety:</strong> {@link #fire()} is safe under concurrent resolutions; the action runs on the
 * first caller's thread only.</p>
 *
 * @since 0.1.0
 */
public final class OneTimeNotice {
  private static final Logger log = LoggerFactory.getLogger(OneTimeNotice.class);

  private final AtomicBoolean fired = new AtomicBoolean();
  private final Runnable action;

  /**
   * Creates a notice around {@code action}.
   *
   * @param action side effect to run once
   */
  public OneTimeNotice(Runnable action) {
    this.action = Objects.requireNonNull(action, "action");
  }

  /**
   * Builds the warning emitted the first time experimental features are enabled.
   *
   * @return new notice that has not fired yet
   */
  public static OneTimeNotice experimentalFeatures() {
    return new OneTimeNotice(() -> {
      log.warn("You have enabled experimental feature(s).");
      log.warn("Experimental features are not covered by semantic versioning and may cause unexpected or broken "
          + "application behavior. Use them at your own risk.");
    });
  }

  /**
   * Runs the action if no earlier call did.
   *
   * @return {@code true} when this call ran the action
   */
  public boolean fire() {
    if (fired.compareAndSet(false, true)) {
      action.run();
      return true;
    }
    return false;
  }

  /**
   * Indicates whether the action already ran.
   *
   * @return {@code true} after the first {@link #fire()}
   */
  public boolean hasFired() {
    return fired.get();
  }
}
