package changefeed.announce;

/**
 * mIRC formatting codes used in announcement lines.
 */
public final class Colors {

  public static final String NORMAL = "\u000f";
  public static final String DARKBLUE = "\u000302";
  public static final String RED = "\u000304";
  public static final String BLUE = "\u000312";
  public static final String DARKGRAY = "\u000314";

  private Colors() {
  }

  /**
   * Removes color and reset codes, leaving plain text.
   */
  public static String strip(String line) {
    return line.replaceAll("\u0003\\d{1,2}|\u000f", "");
  }
}
