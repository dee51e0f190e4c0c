package ephemera.spi;

import ephemera.model.ContentItem;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link ContentItem} rows.
 *
 * <p>All methods take an explicit connection. Implementations throw an unchecked exception on
 * storage failure.
 */
public interface ContentRepository {

    /**
     * Inserts a new item.
     *
     * @param conn the JDBC connection
     * @param item the item to insert
     */
    void insert(Connection conn, ContentItem item);

    /**
     * Looks up an item by id.
     *
     * @param conn the JDBC connection
     * @param id   item identifier
     * @return the item, or empty if no row exists
     */
    Optional<ContentItem> findById(Connection conn, String id);

    /**
     * Returns ephemeral items whose {@code expiresAt} is strictly before {@code now}, oldest
     * expiry first.
     *
     * @param conn  the JDBC connection
     * @param now   the evaluation instant
     * @param limit maximum number of items to return
     * @return expired ephemeral items, never {@code null}
     */
    List<ContentItem> queryExpiredEphemeral(Connection conn, Instant now, int limit);

    /**
     * Deletes an item row. Deleting an absent row is not an error.
     *
     * @param conn the JDBC connection
     * @param id   item identifier
     * @return number of rows removed (0 or 1)
     */
    int delete(Connection conn, String id);
}
