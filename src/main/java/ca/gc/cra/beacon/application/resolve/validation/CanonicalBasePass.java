package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigValue;

/** Strips one trailing {@code /} from {@code amp.canonicalBase}. */
final class CanonicalBasePass implements ValidationPass {
  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    return Trees.mapping(config, "amp")
        .flatMap(amp -> Trees.string(amp, "canonicalBase")
            .filter(base -> base.endsWith("/"))
            .map(base -> config.with(
                "amp",
                amp.with("canonicalBase", ConfigValue.Scalar.of(base.substring(0, base.length() - 1))))))
        .orElse(config);
  }
}
