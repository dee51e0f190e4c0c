package ephemera.spi;

import ephemera.model.EngagementKind;

import java.sql.Connection;

/**
 * Persistence for likes and comments that reference a parent content item.
 */
public interface EngagementStore {

    /**
     * Deletes all edges of the given kind attached to a parent item.
     *
     * @param conn     the JDBC connection
     * @param parentId parent item identifier
     * @param kind     edge kind
     * @return number of edges removed; 0 when there were none
     */
    int deleteByParent(Connection conn, String parentId, EngagementKind kind);

    /**
     * Deletes up to {@code limit} edges of the given kind whose parent item no longer exists.
     *
     * <p>The default implementation does nothing.
     *
     * @param conn  the JDBC connection
     * @param kind  edge kind
     * @param limit maximum number of edges to delete
     * @return number of edges removed
     */
    default int deleteOrphans(Connection conn, EngagementKind kind, int limit) {
        return 0;
    }
}
