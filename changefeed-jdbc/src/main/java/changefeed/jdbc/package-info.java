/**
 * JDBC support for the change store: connection provider, statement helper and exception type.
 *
 * @see changefeed.jdbc.store.AbstractJdbcChangeStore
 * @see changefeed.jdbc.store.JdbcChangeStores
 */
package changefeed.jdbc;
