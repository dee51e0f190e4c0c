package ephemera.sweep;

import ephemera.model.ContentItem;
import ephemera.model.EngagementKind;
import ephemera.spi.ConnectionProvider;
import ephemera.spi.ContentRepository;
import ephemera.spi.EngagementStore;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Map-backed repository and engagement store with switchable failures.
 */
public class InMemoryContentStore implements ContentRepository, EngagementStore {

  public final Map<String, ContentItem> items = new LinkedHashMap<>();
  private final Map<EngagementKind, Map<String, Integer>> edges = new EnumMap<>(EngagementKind.class);

  public RuntimeException queryFailure;
  public final Set<String> failLikesFor = new HashSet<>();
  public final Set<String> failCommentsFor = new HashSet<>();
  public final Set<String> failDeleteFor = new HashSet<>();
  public final Set<EngagementKind> failOrphansFor = new HashSet<>();
  public int lastQueryLimit = -1;

  public InMemoryContentStore() {
    for (EngagementKind kind : EngagementKind.values()) {
      edges.put(kind, new LinkedHashMap<>());
    }
  }

  public static Connection dummyConnection() {
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }

  public static ConnectionProvider dummyProvider() {
    return InMemoryContentStore::dummyConnection;
  }

  public synchronized void addEdges(String parentId, EngagementKind kind, int count) {
    edges.get(kind).merge(parentId, count, Integer::sum);
  }

  public synchronized int edgeCount(String parentId, EngagementKind kind) {
    return edges.get(kind).getOrDefault(parentId, 0);
  }

  @Override
  public synchronized void insert(Connection conn, ContentItem item) {
    items.put(item.id(), item);
  }

  @Override
  public synchronized Optional<ContentItem> findById(Connection conn, String id) {
    return Optional.ofNullable(items.get(id));
  }

  @Override
  public synchronized List<ContentItem> queryExpiredEphemeral(Connection conn, Instant now, int limit) {
    lastQueryLimit = limit;
    if (queryFailure != null) {
      throw queryFailure;
    }
    return items.values().stream()
        .filter(i -> i.ephemeral() && i.expiresAt() != null && i.expiresAt().isBefore(now))
        .sorted(Comparator.comparing(ContentItem::expiresAt))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized int delete(Connection conn, String id) {
    if (failDeleteFor.contains(id)) {
      throw new IllegalStateException("row delete rejected");
    }
    return items.remove(id) != null ? 1 : 0;
  }

  @Override
  public synchronized int deleteByParent(Connection conn, String parentId, EngagementKind kind) {
    Set<String> failing = kind == EngagementKind.LIKE ? failLikesFor : failCommentsFor;
    if (failing.contains(parentId)) {
      throw new IllegalStateException(kind.label() + " store unavailable");
    }
    Integer removed = edges.get(kind).remove(parentId);
    return removed != null ? removed : 0;
  }

  @Override
  public synchronized int deleteOrphans(Connection conn, EngagementKind kind, int limit) {
    if (failOrphansFor.contains(kind)) {
      throw new IllegalStateException("orphan scan failed");
    }
    int reclaimed = 0;
    for (String parentId : new ArrayList<>(edges.get(kind).keySet())) {
      if (items.containsKey(parentId)) {
        continue;
      }
      int count = edges.get(kind).get(parentId);
      int take = Math.min(count, limit - reclaimed);
      if (take <= 0) {
        break;
      }
      if (take == count) {
        edges.get(kind).remove(parentId);
      } else {
        edges.get(kind).put(parentId, count - take);
      }
      reclaimed += take;
    }
    return reclaimed;
  }
}
