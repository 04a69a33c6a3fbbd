package cafe.woden.roomlist.order;

import java.util.List;
import java.util.Objects;

/** Well-known and reserved group captions. */
public final class RoomGroupCaptions {

  /** Namespace of groups the list creates itself; these cannot be deleted as tags. */
  public static final String SYSTEM_NAMESPACE = "roomlist.";

  public static final String DIRECT_CHAT = SYSTEM_NAMESPACE + "direct";
  public static final String UNTAGGED = SYSTEM_NAMESPACE + "none";

  public static final String FAVOURITE = "m.favourite";
  public static final String LOW_PRIORITY = "m.lowpriority";

  /** Namespace for user-defined tags. */
  public static final String USER_NAMESPACE = "u.";

  public static final List<String> DEFAULT_TAGS_ORDER =
      List.of(FAVOURITE, USER_NAMESPACE + "*", DIRECT_CHAT, UNTAGGED, LOW_PRIORITY);

  private RoomGroupCaptions() {}

  public static boolean isSystemCaption(String caption) {
    return Objects.toString(caption, "").startsWith(SYSTEM_NAMESPACE);
  }
}
