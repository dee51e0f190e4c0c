/**
 * JDBC content repositories per database, auto-detected from the JDBC URL, and the engagement
 * stores that go with them.
 *
 * @see ephemera.jdbc.store.JdbcContentRepositories
 */
package ephemera.jdbc.store;
