/**
 * JDBC {@link changefeed.spi.ChangeStore} implementations.
 *
 * <p>{@link changefeed.jdbc.store.AbstractJdbcChangeStore} holds the shared SQL; subclasses
 * supply the insert-or-ignore form of their database: H2 ({@code INSERT ... WHERE NOT EXISTS}),
 * MySQL ({@code ON DUPLICATE KEY UPDATE}) and PostgreSQL ({@code ON CONFLICT DO NOTHING}).
 *
 * @see changefeed.jdbc.store.JdbcChangeStores
 */
package changefeed.jdbc.store;
