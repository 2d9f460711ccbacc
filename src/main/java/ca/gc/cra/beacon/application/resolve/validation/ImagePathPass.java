package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigValue;

/** Appends a trailing {@code /} to a non-empty {@code images.path}. */
final class ImagePathPass implements ValidationPass {
  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    return Trees.mapping(config, "images")
        .flatMap(images -> Trees.string(images, "path")
            .filter(path -> !path.isEmpty() && !path.endsWith("/"))
            .map(path -> config.with("images", images.with("path", ConfigValue.Scalar.of(path + "/")))))
        .orElse(config);
  }
}
