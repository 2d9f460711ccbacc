package ca.gc.cra.beacon.domain.config;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/** Rendering mode flag under {@code experimental.reactMode}. */
public enum ReactMode {
  LEGACY("legacy"),
  BLOCKING("blocking"),
  CONCURRENT("concurrent");

  private final String value;

  ReactMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<ReactMode> fromValue(String raw) {
    return Arrays.stream(values()).filter(m -> m.value.equals(raw)).findFirst();
  }

  public static String allowedValues() {
    return Arrays.stream(values()).map(ReactMode::value).collect(Collectors.joining(", "));
  }
}
