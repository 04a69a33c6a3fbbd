package cafe.woden.roomlist.api;

import cafe.woden.roomlist.model.RoomAspect;
import java.util.Set;

/** {@link RoomListListener} callbacks as values, for stream consumers. */
public sealed interface RoomListChange
    permits RoomListChange.GroupInserted,
        RoomListChange.RoomInserted,
        RoomListChange.RoomRemoved,
        RoomListChange.GroupRemoved,
        RoomListChange.RoomMoved,
        RoomListChange.DataChanged,
        RoomListChange.FullReset {

  record GroupInserted(int groupPosition) implements RoomListChange {}

  record RoomInserted(int groupPosition, int roomPosition) implements RoomListChange {}

  record RoomRemoved(int groupPosition, int roomPosition) implements RoomListChange {}

  record GroupRemoved(int groupPosition) implements RoomListChange {}

  record RoomMoved(int groupPosition, int oldRoomPosition, int newRoomPosition)
      implements RoomListChange {}

  record DataChanged(int groupPosition, int roomPosition, Set<RoomAspect> aspects)
      implements RoomListChange {
    public DataChanged {
      aspects = (aspects == null) ? Set.of() : Set.copyOf(aspects);
    }
  }

  record FullReset() implements RoomListChange {}
}
