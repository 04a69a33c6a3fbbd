package cafe.woden.roomlist.index;

/**
 * Result of {@link RoomGroupIndex#insertGroupIfAbsent(String)}.
 *
 * @param position position of the group, whether it already existed or not
 * @param created true if the group was inserted by this call
 */
public record GroupInsertion(int position, boolean created) {}
