package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_-]*$");

  private CliArgsParser() {}

  /**
   * Splits each argument on the first {@code '='} and checks the key against {@code allowedKeys}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @param allowedKeys keys the command understands
   * @return mutable map in argument order
   * @throws IllegalArgumentException for malformed, unknown or repeated keys
   */
  public static Map<String, String> toMap(String[] args, Set<String> allowedKeys) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!allowedKeys.contains(key)) {
        throw new IllegalArgumentException("unknown argument: " + key);
      }
      String value = Strings.requireNonBlank(key, arg.substring(idx + 1));
      if (map.put(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }
}
