package cafe.woden.roomlist.model;

import io.reactivex.rxjava3.core.Flowable;
import java.util.Map;

/**
 * A chat room as seen by the room list.
 *
 * <p>Rooms are owned by their source; the list only keeps references. Implementations must deliver
 * {@link #events()} synchronously on the thread that mutates the room.
 */
public interface Room {

  RoomRef ref();

  default String id() {
    return ref().roomId();
  }

  default String sourceId() {
    return ref().sourceId();
  }

  String displayName();

  boolean isDirectChat();

  JoinState joinState();

  /**
   * Current tags, keyed by tag name.
   *
   * <p>Iteration order must be deterministic; it determines the order of {@code groups(room)}.
   */
  Map<String, TagOrder> tags();

  default TagOrder tag(String name) {
    TagOrder order = tags().get(name);
    return order == null ? TagOrder.omitted() : order;
  }

  /** Number of unread messages, or {@code -1} if unknown. */
  int unreadCount();

  /** True if {@link #unreadCount()} only counts up to the read marker and more may exist. */
  boolean unreadCountIsLowerBound();

  /** Removes a tag, emitting the tag-change pair if the room had it. */
  void removeTag(String name);

  Flowable<RoomEvent> events();
}
