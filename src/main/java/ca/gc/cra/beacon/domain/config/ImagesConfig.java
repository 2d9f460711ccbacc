package ca.gc.cra.beacon.domain.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Image-serving parameters.
 *
 * @param deviceSizes breakpoint widths used for responsive images, in pixels
 * @param imageSizes additional fixed widths, in pixels
 * @param domains remote hosts allowed as image sources
 * @param path URL path of the image endpoint; a non-empty path ends with {@code /} after resolution
 * @param loader loader identifier
 * @param extras unrecognized keys, passed through
 */
public record ImagesConfig(
    List<Number> deviceSizes,
    List<Number> imageSizes,
    List<String> domains,
    String path,
    String loader,
    Map<String, Object> extras) {
  private static final Set<String> KNOWN = Set.of("deviceSizes", "imageSizes", "domains", "path", "loader");

  public ImagesConfig {
    deviceSizes = List.copyOf(deviceSizes);
    imageSizes = List.copyOf(imageSizes);
    domains = List.copyOf(domains);
    extras = Fields.copyOf(extras);
  }

  static ImagesConfig fromMapping(ConfigValue.Mapping tree) {
    return new ImagesConfig(
        Fields.numberList(tree, "deviceSizes", "images.deviceSizes"),
        Fields.numberList(tree, "imageSizes", "images.imageSizes"),
        Fields.stringList(tree, "domains", "images.domains"),
        Fields.string(tree, "path", "images.path"),
        Fields.string(tree, "loader", "images.loader"),
        Fields.extras(tree, KNOWN));
  }

  ConfigValue.Mapping toMapping() {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    map.put("deviceSizes", Fields.numbers(deviceSizes));
    map.put("imageSizes", Fields.numbers(imageSizes));
    map.put("domains", ConfigValue.Sequence.ofStrings(domains));
    map.put("path", ConfigValue.Scalar.of(path));
    map.put("loader", ConfigValue.Scalar.of(loader));
    Fields.putExtras(map, extras);
    return new ConfigValue.Mapping(map);
  }
}
