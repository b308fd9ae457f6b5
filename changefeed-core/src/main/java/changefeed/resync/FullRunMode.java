package changefeed.resync;

/**
 * Selects how a full resync enumerates identifiers. {@link #NONE} means no full run: the
 * engine polls the change feed instead.
 */
public enum FullRunMode {
  /** Normal operation, no full run. */
  NONE,
  /** Every stored app (including package-linked apps) and every stored package. */
  NORMAL,
  /** Every id from zero up to the highest known id plus padding. */
  ENUMERATE,
  /** Only ids already known to require an access token. */
  TOKENS_ONLY,
  /** Stored packages only, no apps. */
  PACKAGES_NORMAL,
  /** Like {@link #NORMAL} for apps; packages are skipped. */
  WITH_FORCED_DEPOTS
}
