package ca.gc.cra.beacon.application.resolve.validation;

import ca.gc.cra.beacon.domain.config.ConfigException;
import ca.gc.cra.beacon.domain.config.ConfigValue;
import ca.gc.cra.beacon.domain.config.ConfigValues;
import ca.gc.cra.beacon.domain.config.ErrorKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the {@code images} record.
 *
 * <p>{@code domains} holds at most {@value #MAX_DOMAINS} strings. {@code deviceSizes} and {@code imageSizes} hold
 * at most {@value #MAX_SIZES} numbers between {@value #MIN_SIZE} and {@value #MAX_SIZE}.</p>
 */
final class ImagesPass implements ValidationPass {
  static final int MAX_DOMAINS = 50;
  static final int MAX_SIZES = 25;
  static final int MIN_SIZE = 1;
  static final int MAX_SIZE = 10_000;

  @Override
  public ConfigValue.Mapping apply(ConfigValue.Mapping config) {
    ConfigValue value = config.entries().get("images");
    if (ConfigValues.isAbsent(value)) {
      return config;
    }
    if (!(value instanceof ConfigValue.Mapping images)) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified images should be an object received " + ConfigValues.typeName(value) + ".");
    }
    Trees.defined(images, "domains").ifPresent(ImagesPass::checkDomains);
    Trees.defined(images, "deviceSizes").ifPresent(sizes -> checkSizes("deviceSizes", sizes));
    Trees.defined(images, "imageSizes").ifPresent(sizes -> checkSizes("imageSizes", sizes));
    return config;
  }

  private static void checkDomains(ConfigValue value) {
    if (!(value instanceof ConfigValue.Sequence domains)) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified images.domains should be an Array received " + ConfigValues.typeName(value) + ".");
    }
    if (domains.size() > MAX_DOMAINS) {
      throw new ConfigException(
          ErrorKind.RANGE_VIOLATION,
          "Specified images.domains exceeds length of " + MAX_DOMAINS + ", received length (" + domains.size()
              + "), please reduce the length of the array to continue.");
    }
    List<String> invalid = new ArrayList<>();
    for (ConfigValue domain : domains.items()) {
      if (ConfigValues.stringOrNull(domain) == null) {
        invalid.add(ConfigValues.describe(domain));
      }
    }
    if (!invalid.isEmpty()) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified images.domains should be an Array of strings received invalid values ("
              + String.join(", ", invalid) + ").");
    }
  }

  private static void checkSizes(String key, ConfigValue value) {
    if (!(value instanceof ConfigValue.Sequence sizes)) {
      throw new ConfigException(
          ErrorKind.TYPE_MISMATCH,
          "Specified images." + key + " should be an Array received " + ConfigValues.typeName(value) + ".");
    }
    if (sizes.size() > MAX_SIZES) {
      throw new ConfigException(
          ErrorKind.RANGE_VIOLATION,
          "Specified images." + key + " exceeds length of " + MAX_SIZES + ", received length (" + sizes.size()
              + "), please reduce the length of the array to continue.");
    }
    List<String> invalid = new ArrayList<>();
    for (ConfigValue size : sizes.items()) {
      if (!isValidSize(size)) {
        invalid.add(ConfigValues.describe(size));
      }
    }
    if (!invalid.isEmpty()) {
      throw new ConfigException(
          ErrorKind.RANGE_VIOLATION,
          "Specified images." + key + " should be an Array of numbers that are between " + MIN_SIZE + " and "
              + MAX_SIZE + ", received invalid values (" + String.join(", ", invalid) + ").");
    }
  }

  private static boolean isValidSize(ConfigValue value) {
    if (!(value instanceof ConfigValue.Scalar scalar) || !(scalar.value() instanceof Number number)) {
      return false;
    }
    double size = number.doubleValue();
    return Double.isFinite(size) && size >= MIN_SIZE && size <= MAX_SIZE;
  }
}
