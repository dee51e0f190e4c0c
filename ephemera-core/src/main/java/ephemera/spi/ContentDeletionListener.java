package ephemera.spi;

import ephemera.model.ContentItem;

/**
 * Callback invoked after a content item row has been deleted, by the sweeper or by an explicit
 * owner deletion.
 *
 * <p>Exceptions thrown by listeners are logged and otherwise ignored.
 */
@FunctionalInterface
public interface ContentDeletionListener {

    ContentDeletionListener NOOP = item -> { };

    /**
     * @param item the item as it was read before deletion
     */
    void onDeleted(ContentItem item);
}
