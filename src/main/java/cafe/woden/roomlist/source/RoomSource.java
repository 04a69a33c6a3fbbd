package cafe.woden.roomlist.source;

import cafe.woden.roomlist.model.Room;
import io.reactivex.rxjava3.core.Flowable;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A live connection that owns a mutable set of rooms.
 *
 * <p>{@link #events()} must be delivered synchronously on the thread that changes the source.
 */
public interface RoomSource {

  /** Stable source id; also the source id of every room it owns. */
  String id();

  /** The user this source is logged in as. Used to disambiguate rooms shared by several sources. */
  String userId();

  /** Snapshot of the rooms currently owned, in a deterministic order. */
  Collection<Room> rooms();

  Optional<Room> room(String roomId);

  default List<Room> roomsWithTag(String tag) {
    return rooms().stream().filter(r -> r.tags().containsKey(tag)).toList();
  }

  default int roomCount() {
    return rooms().size();
  }

  Flowable<SourceEvent> events();
}
