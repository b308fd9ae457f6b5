package changefeed.announce;

import java.util.Objects;

/**
 * Builds web links to changelists and item history pages.
 */
public final class Links {
  public static final String DEFAULT_BASE_URL = "https://steamdb.info";

  private final String baseUrl;

  public Links() {
    this(DEFAULT_BASE_URL);
  }

  public Links(String baseUrl) {
    Objects.requireNonNull(baseUrl, "baseUrl");
    if (baseUrl.isBlank()) {
      throw new IllegalArgumentException("baseUrl must not be blank");
    }
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  public String changelist(long changeNumber) {
    return baseUrl + "/changelist/" + changeNumber + "/";
  }

  public String appHistory(int appId) {
    return baseUrl + "/app/" + appId + "/history/";
  }

  public String packageHistory(int packageId) {
    return baseUrl + "/sub/" + packageId + "/history/";
  }
}
