package changefeed.model;

/**
 * The two kinds of catalog items a change feed reports.
 */
public enum ItemKind {
  APP,
  PACKAGE
}
