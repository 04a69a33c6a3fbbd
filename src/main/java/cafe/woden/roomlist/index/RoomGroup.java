package cafe.woden.roomlist.index;

import cafe.woden.roomlist.model.Room;
import java.util.ArrayList;
import java.util.Objects;

/** A caption and the rooms listed under it, kept sorted by the owning index. */
final class RoomGroup {
  final String caption;
  final ArrayList<Room> rooms = new ArrayList<>();

  RoomGroup(String caption) {
    this.caption = Objects.requireNonNull(caption, "caption");
  }

  @Override
  public String toString() {
    return "RoomGroup{" + caption + " x" + rooms.size() + "}";
  }
}
