package cafe.woden.roomlist.api;

import cafe.woden.roomlist.model.RoomAspect;
import java.util.Set;

/**
 * Receives row-level changes of the room list.
 *
 * <p>Positions refer to the state right after the change. A {@link #fullReset()} invalidates every
 * position obtained before it. Callbacks run on the thread that triggered the change, after the
 * index has been updated.
 */
public interface RoomListListener {

  default void groupInserted(int groupPosition) {}

  default void roomInserted(int groupPosition, int roomPosition) {}

  /** {@code roomPosition} is where the room used to be. */
  default void roomRemoved(int groupPosition, int roomPosition) {}

  /** Follows the {@link #roomRemoved} of the group's last room. */
  default void groupRemoved(int groupPosition) {}

  /** {@code newRoomPosition} is the index of the room after the move. */
  default void roomMoved(int groupPosition, int oldRoomPosition, int newRoomPosition) {}

  /** An empty {@code aspects} set means every aspect may have changed. */
  default void dataChanged(int groupPosition, int roomPosition, Set<RoomAspect> aspects) {}

  default void fullReset() {}
}
