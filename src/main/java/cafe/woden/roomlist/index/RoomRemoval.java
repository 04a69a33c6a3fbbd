package cafe.woden.roomlist.index;

import cafe.woden.roomlist.model.Room;

/**
 * Result of {@link RoomGroupIndex#removeRoom(int, int)}.
 *
 * <p>When {@code groupRemoved} is set the group at {@code groupPosition} went away together with
 * its last room; the room removal happened first.
 */
public record RoomRemoval(
    Room room, String caption, int groupPosition, int roomPosition, boolean groupRemoved) {}
