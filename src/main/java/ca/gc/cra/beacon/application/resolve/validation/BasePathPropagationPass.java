package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigValue;

/** Copies a non-empty {@code basePath} into an empty {@code assetPrefix} and an empty {@code amp.canonicalBase}. */
final class BasePathPropagationPass implements ValidationPass {
  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    String basePath = Trees.string(config, "basePath").orElse("");
    if (basePath.isEmpty()) {
      return config;
    }
    ConfigValue.Scalar prefix = ConfigValue.Scalar.of(basePath);
    ConfigValue.Mapping result = config;
    if (Trees.string(result, "assetPrefix").map(String::isEmpty).orElse(false)) {
      result = result.with("assetPrefix", prefix);
    }
    ConfigValue.Mapping amp = Trees.mapping(result, "amp").orElse(null);
    if (amp != null && Trees.string(amp, "canonicalBase").map(String::isEmpty).orElse(false)) {
      result = result.with("amp", amp.with("canonicalBase", prefix));
    }
    return result;
  }
}
