package cafe.woden.roomlist.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attached sources, in attach order.
 *
 * <p>Iteration order is the attach order so rebuilds are reproducible. Not thread-safe; owned by
 * the room list coordinator.
 */
public final class SourceRegistry {
  private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

  private final List<RoomSource> sources = new ArrayList<>();

  /** @return false if the source (or another source with the same id) is already registered */
  public boolean register(RoomSource source) {
    Objects.requireNonNull(source, "source");
    if (find(source.id()).isPresent()) {
      log.warn("[roomlist] Source '{}' is already attached; ignoring", source.id());
      return false;
    }
    sources.add(source);
    return true;
  }

  public boolean deregister(RoomSource source) {
    if (source == null) return false;
    return sources.remove(source);
  }

  public boolean contains(RoomSource source) {
    return source != null && sources.contains(source);
  }

  public Optional<RoomSource> find(String sourceId) {
    String sid = Objects.toString(sourceId, "").trim();
    for (RoomSource s : sources) {
      if (s.id().equals(sid)) return Optional.of(s);
    }
    return Optional.empty();
  }

  /** Snapshot of attached sources in attach order. */
  public List<RoomSource> sources() {
    return List.copyOf(sources);
  }

  public int size() {
    return sources.size();
  }

  public boolean isEmpty() {
    return sources.isEmpty();
  }

  public int totalRooms() {
    int total = 0;
    for (RoomSource s : sources) {
      total += s.roomCount();
    }
    return total;
  }
}
