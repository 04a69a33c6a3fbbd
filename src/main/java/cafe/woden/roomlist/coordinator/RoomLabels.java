package cafe.woden.roomlist.coordinator;

import cafe.woden.roomlist.model.Room;
import cafe.woden.roomlist.order.RoomGroupCaptions;
import cafe.woden.roomlist.source.RoomSource;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/** Plain-text labels for group and room rows. */
public final class RoomLabels {

  static final String FAVOURITES_LABEL = "Favourites";
  static final String LOW_PRIORITY_LABEL = "Low priority";
  static final String DIRECT_CHATS_LABEL = "People";
  static final String UNTAGGED_LABEL = "Ungrouped rooms";

  private RoomLabels() {}

  public static String groupLabel(String caption) {
    String c = Objects.toString(caption, "");
    switch (c) {
      case RoomGroupCaptions.UNTAGGED:
        return UNTAGGED_LABEL;
      case RoomGroupCaptions.DIRECT_CHAT:
        return DIRECT_CHATS_LABEL;
      case RoomGroupCaptions.FAVOURITE:
        return FAVOURITES_LABEL;
      case RoomGroupCaptions.LOW_PRIORITY:
        return LOW_PRIORITY_LABEL;
      default:
        return c.startsWith(RoomGroupCaptions.USER_NAMESPACE)
            ? c.substring(RoomGroupCaptions.USER_NAMESPACE.length())
            : c;
    }
  }

  /**
   * Display name of the room, disambiguated with the local user id when another attached source
   * lists a room with the same id in the same join state, plus the unread count if known.
   */
  public static String roomLabel(Room room, Collection<? extends RoomSource> sources) {
    Objects.requireNonNull(room, "room");
    String label = room.displayName();
    if (sources != null && sharedWithAnotherSource(room, sources)) {
      label = label + " (as " + ownerUserId(room, sources) + ")";
    }
    return label + unreadPostfix(room);
  }

  private static boolean sharedWithAnotherSource(
      Room room, Collection<? extends RoomSource> sources) {
    for (RoomSource s : sources) {
      if (s.id().equals(room.sourceId())) continue;
      Optional<Room> other = s.room(room.id());
      if (other.isPresent() && other.get().joinState() == room.joinState()) return true;
    }
    return false;
  }

  private static String ownerUserId(Room room, Collection<? extends RoomSource> sources) {
    for (RoomSource s : sources) {
      if (s.id().equals(room.sourceId()) && !s.userId().isBlank()) return s.userId();
    }
    return room.sourceId();
  }

  private static String unreadPostfix(Room room) {
    int unread = room.unreadCount();
    if (unread < 0) return "";
    return room.unreadCountIsLowerBound() ? " [" + unread + "+]" : " [" + unread + "]";
  }
}
