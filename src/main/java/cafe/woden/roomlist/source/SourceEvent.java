package cafe.woden.roomlist.source;

import cafe.woden.roomlist.model.Room;
import java.util.Objects;

/** Lifecycle signals emitted by a {@link RoomSource}. */
public sealed interface SourceEvent
    permits SourceEvent.RoomAdded,
        SourceEvent.RoomReplaced,
        SourceEvent.RoomRemoved,
        SourceEvent.Disconnected {

  String sourceId();

  /** A room appeared that the source did not have before. */
  record RoomAdded(String sourceId, Room room) implements SourceEvent {
    public RoomAdded {
      Objects.requireNonNull(room, "room");
    }
  }

  /**
   * A room object superseded a previous one for the same id (invite accepted or rejected, or a left
   * room re-joined). {@code previous} holds the prior state.
   */
  record RoomReplaced(String sourceId, Room room, Room previous) implements SourceEvent {
    public RoomReplaced {
      Objects.requireNonNull(room, "room");
    }
  }

  /** The room is about to be dropped by the source. */
  record RoomRemoved(String sourceId, Room room) implements SourceEvent {
    public RoomRemoved {
      Objects.requireNonNull(room, "room");
    }
  }

  /** The source logged out or lost its session; all of its rooms go away. */
  record Disconnected(String sourceId) implements SourceEvent {}
}
