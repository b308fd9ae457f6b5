package changefeed.announce;

import changefeed.model.KnownName;

/**
 * Renders stored names for announcement lines.
 *
 * <p>An item without a stored name is shown as {@code Unknown App <id>} or
 * {@code Unknown Package <id>}. When the item was renamed, the previous name follows in gray.
 */
public final class NameFormatter {
  static final String DEFAULT_APP_TYPE = "App";

  private NameFormatter() {
  }

  public static String app(int appId, KnownName data) {
    return format("Unknown App " + appId, data);
  }

  public static String pkg(int packageId, KnownName data) {
    return format("Unknown Package " + packageId, data);
  }

  /**
   * Returns the stored app type, or {@code App} when none is known.
   */
  public static String appType(KnownName data) {
    if (data == null || isBlank(data.type())) {
      return DEFAULT_APP_TYPE;
    }
    return data.type();
  }

  private static String format(String fallback, KnownName data) {
    if (data == null) {
      return fallback;
    }
    String name = data.name();
    String lastKnown = data.lastKnownName();
    if (isBlank(name)) {
      return isBlank(lastKnown) ? fallback : lastKnown;
    }
    if (!isBlank(lastKnown) && !lastKnown.equals(name)) {
      return name + " " + Colors.DARKGRAY + "(" + lastKnown + ")" + Colors.NORMAL;
    }
    return name;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
