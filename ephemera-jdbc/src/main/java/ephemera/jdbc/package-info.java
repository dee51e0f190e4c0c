/**
 * JDBC building blocks shared by the content stores: connection provision, table naming and a
 * small statement helper.
 *
 * @see ephemera.jdbc.store
 */
package ephemera.jdbc;
