package cafe.woden.roomlist.source;

import cafe.woden.roomlist.model.Room;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RoomSource} backed by an insertion-ordered map.
 *
 * <p>Mutators emit the matching {@link SourceEvent} after the room map is updated, except for
 * {@link #removeRoom(String)} which emits before dropping the room so listeners can still resolve
 * it.
 */
public class InMemoryRoomSource implements RoomSource {

  private final String id;
  private final String userId;
  private final LinkedHashMap<String, Room> rooms = new LinkedHashMap<>();
  private final FlowableProcessor<SourceEvent> events =
      PublishProcessor.<SourceEvent>create().toSerialized();

  public InMemoryRoomSource(String id, String userId) {
    this.id = Objects.toString(id, "").trim();
    if (this.id.isEmpty()) throw new IllegalArgumentException("source id must not be blank");
    this.userId = Objects.toString(userId, "").trim();
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String userId() {
    return userId;
  }

  @Override
  public synchronized Collection<Room> rooms() {
    return List.copyOf(rooms.values());
  }

  @Override
  public synchronized Optional<Room> room(String roomId) {
    return Optional.ofNullable(rooms.get(roomId));
  }

  @Override
  public synchronized int roomCount() {
    return rooms.size();
  }

  @Override
  public Flowable<SourceEvent> events() {
    return events;
  }

  /**
   * Adds a room, or replaces the room with the same id.
   *
   * @return the previous room with that id, or {@code null}
   */
  public Room putRoom(Room room) {
    Objects.requireNonNull(room, "room");
    requireOwned(room);
    Room previous;
    synchronized (this) {
      previous = rooms.put(room.id(), room);
    }
    if (previous == null) {
      events.onNext(new SourceEvent.RoomAdded(id, room));
    } else {
      events.onNext(new SourceEvent.RoomReplaced(id, room, previous));
    }
    return previous;
  }

  /** Adds rooms without emitting events, e.g. to seed the source before it is attached. */
  public synchronized InMemoryRoomSource seed(Collection<? extends Room> seedRooms) {
    for (Room r : new ArrayList<>(seedRooms)) {
      requireOwned(r);
      rooms.put(r.id(), r);
    }
    return this;
  }

  public Optional<Room> removeRoom(String roomId) {
    Room room;
    synchronized (this) {
      room = rooms.get(roomId);
    }
    if (room == null) return Optional.empty();
    events.onNext(new SourceEvent.RoomRemoved(id, room));
    synchronized (this) {
      rooms.remove(roomId);
    }
    return Optional.of(room);
  }

  public void disconnect() {
    events.onNext(new SourceEvent.Disconnected(id));
  }

  private void requireOwned(Room room) {
    if (!id.equals(room.sourceId())) {
      throw new IllegalArgumentException(
          "room " + room.ref() + " does not belong to source '" + id + "'");
    }
  }

  @Override
  public String toString() {
    return "InMemoryRoomSource{" + id + " as " + userId + "}";
  }
}
