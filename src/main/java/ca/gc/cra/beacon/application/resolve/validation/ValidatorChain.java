package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigValue;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered list of {@link ValidationPass}es applied left to right.
 * <p><strong>Why:</strong> Later passes rely on the fixups of earlier ones (base path propagation runs after the
 * base path is checked; locale reordering runs after the i18n record is checked), so the order is fixed here rather
 * than left to callers.</p>
 * <p><strong>Thread-safety:</strong> Immutable; passes are stateless.</p>
 *
 * @since 0.1.0
 */
public final class ValidatorChain {
  private final List<ValidationPass> passes;

  /**
   * Creates a chain.
   *
   * @param passes passes in application order
   */
  public ValidatorChain(List<ValidationPass> passes) {
    this.passes = List.copyOf(Objects.requireNonNull(passes, "passes"));
  }

  /**
   * Checks applied to the raw user configuration before it is merged with defaults.
   *
   * @return target and React mode checks followed by the AMP canonical base fixup
   */
  public static ValidatorChain preMerge() {
    return new ValidatorChain(List.of(
        new TargetPass(),
        new ReactModePass(),
        new CanonicalBasePass()));
  }

  /**
   * Checks applied to the merged configuration.
   *
   * @return chain covering the build directory, page extensions, asset prefix, base path, images and i18n
   */
  public static ValidatorChain postMerge() {
    return new ValidatorChain(List.of(
        new BuildDirectoryPass(),
        new PageExtensionsPass(),
        new AssetPrefixPass(),
        new BasePathPass(),
        new BasePathPropagationPass(),
        new ImagesPass(),
        new ImagePathPass(),
        new I18nPass(),
        new LocaleOrderPass()));
  }

  /**
   * Runs every pass in order.
   *
   * @param config tree to check
   * @return tree produced by the last pass
   */
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    ConfigValue.Mapping current = Objects.requireNonNull(config, "config");
    for (ValidationPass pass : passes) {
      current = pass.apply(current);
    }
    return current;
  }

  List<ValidationPass> passes() {
    return passes;
  }
}
