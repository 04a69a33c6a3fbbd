package cafe.woden.roomlist.model;

/**
 * Display aspects of a room row that can change without affecting grouping or order.
 *
 * <p>An empty aspect set in a change notification means every aspect may have changed.
 */
public enum RoomAspect {
  DISPLAY_NAME,
  AVATAR,
  UNREAD,
  JOIN_STATE
}
